package com.ryuqq.release.application.coordinator;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ServiceName;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.statemachine.ReleaseState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 릴리스 결과.
 *
 * <p>success는 status가 SUCCESS일 때만 true입니다. serviceResults는 요청 순서,
 * deploymentOrder는 실제로 시도된 순서입니다.</p>
 *
 * @param success 릴리스 성공 여부
 * @param releaseId 릴리스 ID
 * @param environment 대상 환경
 * @param timestamp 릴리스 시작 시각
 * @param status 최종 상태 (SUCCESS, FAILED, ROLLED_BACK)
 * @param summary 결과 집계
 * @param deploymentOrder 실제 배포 시도 순서
 * @param serviceResults 서비스별 결과 (요청 순서)
 * @param overallHealth 전체 헬스
 * @param releaseNotes 릴리스 노트 경로 (생성 실패 또는 생성기 없음이면 null)
 * @param warnings 검증 경고 (고립된 서비스 등)
 * @param recorded 레지스트리 기록 성공 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CoordinateReleaseResult(
    boolean success,
    ReleaseId releaseId,
    Environment environment,
    Instant timestamp,
    ReleaseState status,
    ReleaseSummary summary,
    List<ServiceName> deploymentOrder,
    List<ServiceResult> serviceResults,
    HealthStatus overallHealth,
    String releaseNotes,
    List<String> warnings,
    boolean recorded
) {

    public CoordinateReleaseResult {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        if (success != (status == ReleaseState.SUCCESS)) {
            throw new IllegalArgumentException("success must match status (status: " + status + ")");
        }
        deploymentOrder = deploymentOrder == null ? List.of() : List.copyOf(deploymentOrder);
        serviceResults = serviceResults == null ? List.of() : List.copyOf(serviceResults);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * 서비스 결과 조회.
     *
     * @param service 서비스 이름
     * @return 해당 서비스 결과 (없으면 empty)
     */
    public Optional<ServiceResult> resultOf(ServiceName service) {
        return serviceResults.stream().filter(result -> result.service().equals(service)).findFirst();
    }

    public Optional<ServiceResult> resultOf(String service) {
        return resultOf(ServiceName.of(service));
    }
}
