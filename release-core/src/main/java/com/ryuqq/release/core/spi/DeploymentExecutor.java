package com.ryuqq.release.core.spi;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceResult;

import java.time.Duration;

/**
 * 서비스 한 개의 실제 배포/롤백을 수행하는 외부 실행자.
 *
 * <p>코디네이터는 이 인터페이스만 호출하며, 배포 메커니즘(컨테이너, 프로세스, 원격 API 등)은
 * 구현체의 책임입니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>같은 배치의 서비스들에 대해 여러 스레드에서 동시에 호출됩니다.</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 *   <li>코디네이터가 타임아웃으로 작업을 취소하면 실행 스레드가 인터럽트됩니다.</li>
 * </ul>
 *
 * <p><strong>실패 보고:</strong> 실패는 {@code FAILED} 상태의 ServiceResult로 반환하거나
 * {@link com.ryuqq.release.core.exception.DeploymentException}을 던질 수 있습니다.
 * 두 경우 모두 코디네이터는 같은 실패로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeploymentExecutor {

    /**
     * 서비스 배포.
     *
     * @param service 배포할 서비스 선언 (config는 그대로 전달)
     * @param environment 대상 환경
     * @param timeout 적용되는 타임아웃 (제한 없으면 null)
     * @return 배포 결과
     * @throws com.ryuqq.release.core.exception.DeploymentException 배포가 실패한 경우
     */
    ServiceResult deploy(ServiceDeclaration service, Environment environment, Duration timeout);

    /**
     * 이전에 성공한 배포를 되돌림.
     *
     * @param service 롤백할 서비스 선언
     * @param environment 대상 환경
     * @param reason 롤백 사유
     * @return 롤백 결과 ({@code FAILED}이면 롤백 실패)
     * @throws com.ryuqq.release.core.exception.DeploymentException 롤백이 실패한 경우
     */
    ServiceResult rollback(ServiceDeclaration service, Environment environment, String reason);
}
