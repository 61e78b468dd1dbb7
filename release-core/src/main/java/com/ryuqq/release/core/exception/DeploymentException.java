package com.ryuqq.release.core.exception;

/**
 * 단일 서비스의 배포/롤백 실패.
 *
 * <p>{@code DeploymentExecutor} 구현체가 던질 수 있으며, 코디네이터는 이 예외를
 * 해당 서비스의 {@code ServiceResult}(FAILED)로 변환합니다.
 * 코디네이터 밖으로 전파되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DeploymentException extends RuntimeException {

    private final String service;

    public DeploymentException(String service, String message) {
        super(message);
        this.service = service;
    }

    public DeploymentException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    /**
     * 실패한 서비스 이름.
     *
     * @return 서비스 이름
     */
    public String getService() {
        return service;
    }
}
