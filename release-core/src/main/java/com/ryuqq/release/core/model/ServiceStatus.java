package com.ryuqq.release.core.model;

/**
 * 릴리스 내 개별 서비스의 최종 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ServiceStatus {

    /**
     * 배포 성공.
     */
    SUCCESS("success"),

    /**
     * 배포 실패 또는 타임아웃 (롤백 실패 포함).
     */
    FAILED("failed"),

    /**
     * 배포 성공 후 같은 릴리스의 이후 실패로 인해 롤백됨.
     */
    ROLLED_BACK("rolled-back"),

    /**
     * 앞선 배치 실패로 시도되지 않음.
     */
    SKIPPED("skipped");

    private final String value;

    ServiceStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 외부 표현 값으로부터 상태 조회.
     *
     * @param value 상태 값
     * @return ServiceStatus
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ServiceStatus fromValue(String value) {
        for (ServiceStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown service status: " + value);
    }

    /**
     * 배포가 실제로 시도되었는지 여부.
     *
     * @return SKIPPED가 아니면 true
     */
    public boolean wasAttempted() {
        return this != SKIPPED;
    }
}
