package com.ryuqq.release.core.model;

/**
 * 헬스 판정.
 *
 * <p>서비스 단위로는 {@link #UNKNOWN}(시도되지 않은 서비스)까지 4가지,
 * 릴리스 전체 판정으로는 HEALTHY, DEGRADED, UNHEALTHY 3가지만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY("healthy"),

    /**
     * 치명적이지 않은 경고.
     */
    DEGRADED("degraded"),

    UNHEALTHY("unhealthy"),

    /**
     * 헬스 정보 없음 (SKIPPED 서비스).
     */
    UNKNOWN("unknown");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 외부 표현 값으로부터 헬스 조회.
     *
     * @param value 헬스 값
     * @return HealthStatus
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static HealthStatus fromValue(String value) {
        for (HealthStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }
}
