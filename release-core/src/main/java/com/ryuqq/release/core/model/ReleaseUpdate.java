package com.ryuqq.release.core.model;

import com.ryuqq.release.core.statemachine.ReleaseState;

import java.util.List;

/**
 * ReleaseRecord 부분 갱신.
 *
 * <p>null인 필드는 "변경 없음"을 의미합니다.</p>
 *
 * <pre>
 * ReleaseUpdate update = ReleaseUpdate.builder()
 *     .status(ReleaseState.SUCCESS)
 *     .durationMs(1200L)
 *     .overallHealth(HealthStatus.HEALTHY)
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReleaseUpdate(
    ReleaseState status,
    List<ServiceName> deploymentOrder,
    List<ServiceResult> serviceResults,
    Long durationMs,
    HealthStatus overallHealth,
    String releaseNotesPath
) {

    public ReleaseUpdate {
        deploymentOrder = deploymentOrder == null ? null : List.copyOf(deploymentOrder);
        serviceResults = serviceResults == null ? null : List.copyOf(serviceResults);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * ReleaseUpdate 빌더.
     */
    public static final class Builder {

        private ReleaseState status;
        private List<ServiceName> deploymentOrder;
        private List<ServiceResult> serviceResults;
        private Long durationMs;
        private HealthStatus overallHealth;
        private String releaseNotesPath;

        private Builder() {
        }

        public Builder status(ReleaseState status) {
            this.status = status;
            return this;
        }

        public Builder deploymentOrder(List<ServiceName> deploymentOrder) {
            this.deploymentOrder = deploymentOrder;
            return this;
        }

        public Builder serviceResults(List<ServiceResult> serviceResults) {
            this.serviceResults = serviceResults;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder overallHealth(HealthStatus overallHealth) {
            this.overallHealth = overallHealth;
            return this;
        }

        public Builder releaseNotesPath(String releaseNotesPath) {
            this.releaseNotesPath = releaseNotesPath;
            return this;
        }

        public ReleaseUpdate build() {
            return new ReleaseUpdate(status, deploymentOrder, serviceResults, durationMs, overallHealth, releaseNotesPath);
        }
    }
}
