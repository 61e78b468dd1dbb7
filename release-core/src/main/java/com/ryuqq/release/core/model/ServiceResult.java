package com.ryuqq.release.core.model;

/**
 * 릴리스 내 개별 서비스의 실행 결과.
 *
 * <p>실행자가 보고한 결과와 코디네이터가 측정한 소요 시간을 합친 값입니다.
 * 롤백이 수행되면 {@link #rolledBack(String)}으로 상태가 바뀐 새 인스턴스가 만들어집니다.</p>
 *
 * @param service 서비스 이름
 * @param status 최종 상태
 * @param deploymentId 실행자가 발급한 배포 ID (시도되지 않았거나 실패로 발급되지 않은 경우 null)
 * @param version 배포 버전
 * @param durationMs 소요 시간 (밀리초)
 * @param healthStatus 서비스 헬스
 * @param message 실패/타임아웃/롤백 상세 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServiceResult(
    ServiceName service,
    ServiceStatus status,
    String deploymentId,
    String version,
    long durationMs,
    HealthStatus healthStatus,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 durationMs가 음수인 경우
     */
    public ServiceResult {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (healthStatus == null) {
            throw new IllegalArgumentException("healthStatus cannot be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative (current: " + durationMs + ")");
        }
    }

    /**
     * 성공 결과.
     */
    public static ServiceResult success(ServiceName service, String deploymentId, String version,
                                        long durationMs, HealthStatus healthStatus) {
        return new ServiceResult(service, ServiceStatus.SUCCESS, deploymentId, version, durationMs, healthStatus, null);
    }

    /**
     * 실패 결과 (헬스는 항상 UNHEALTHY).
     */
    public static ServiceResult failed(ServiceName service, String deploymentId, String version,
                                       long durationMs, String message) {
        return new ServiceResult(service, ServiceStatus.FAILED, deploymentId, version, durationMs,
            HealthStatus.UNHEALTHY, message);
    }

    /**
     * 시도되지 않은 서비스 결과.
     */
    public static ServiceResult skipped(ServiceName service, String version) {
        return new ServiceResult(service, ServiceStatus.SKIPPED, null, version, 0, HealthStatus.UNKNOWN,
            "not attempted: an earlier batch failed");
    }

    /**
     * 롤백 완료 상태로 전환한 새 인스턴스.
     *
     * @param reason 롤백 사유
     * @return ROLLED_BACK 상태의 ServiceResult
     */
    public ServiceResult rolledBack(String reason) {
        return new ServiceResult(service, ServiceStatus.ROLLED_BACK, deploymentId, version, durationMs,
            healthStatus, reason);
    }

    /**
     * 소요 시간만 변경한 새 인스턴스.
     */
    public ServiceResult withDurationMs(long durationMs) {
        return new ServiceResult(service, status, deploymentId, version, durationMs, healthStatus, message);
    }

    public boolean isSuccess() {
        return status == ServiceStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == ServiceStatus.FAILED;
    }
}
