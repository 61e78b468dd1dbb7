package com.ryuqq.release.core.model;

import com.ryuqq.release.core.statemachine.ReleaseState;
import com.ryuqq.release.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.List;

/**
 * 릴리스 한 건의 기록.
 *
 * <p>coordinateRelease 호출 시 PENDING으로 생성되고, 검증 통과 후 IN_PROGRESS,
 * 배치마다 갱신되다가 종료 상태(SUCCESS, FAILED, ROLLED_BACK)로 레지스트리에 기록됩니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경은 {@link #apply(ReleaseUpdate)}를 통해 새 인스턴스로 만들어지며,
 * 종료 상태의 기록은 더 이상 변경할 수 없습니다.</p>
 *
 * @param releaseId 릴리스 ID
 * @param releaseName 릴리스명
 * @param environment 대상 환경
 * @param timestamp 릴리스 시작 시각
 * @param status 현재 상태
 * @param services 요청된 서비스 이름 (입력 순서)
 * @param deploymentOrder 실제로 시도된 배포 순서 (배치 평탄화)
 * @param serviceResults 서비스별 결과
 * @param durationMs 전체 소요 시간 (밀리초)
 * @param overallHealth 전체 헬스 판정
 * @param releaseNotesPath 릴리스 노트 경로 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReleaseRecord(
    ReleaseId releaseId,
    String releaseName,
    Environment environment,
    Instant timestamp,
    ReleaseState status,
    List<ServiceName> services,
    List<ServiceName> deploymentOrder,
    List<ServiceResult> serviceResults,
    long durationMs,
    HealthStatus overallHealth,
    String releaseNotesPath
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 durationMs가 음수인 경우
     */
    public ReleaseRecord {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        if (releaseName == null || releaseName.isBlank()) {
            throw new IllegalArgumentException("releaseName cannot be null or blank");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (overallHealth == null || overallHealth == HealthStatus.UNKNOWN) {
            throw new IllegalArgumentException("overallHealth must be HEALTHY, DEGRADED or UNHEALTHY (current: " + overallHealth + ")");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative (current: " + durationMs + ")");
        }
        services = services == null ? List.of() : List.copyOf(services);
        deploymentOrder = deploymentOrder == null ? List.of() : List.copyOf(deploymentOrder);
        serviceResults = serviceResults == null ? List.of() : List.copyOf(serviceResults);
    }

    /**
     * PENDING 상태의 새 기록 생성.
     *
     * @param releaseId 릴리스 ID
     * @param releaseName 릴리스명
     * @param environment 대상 환경
     * @param timestamp 시작 시각
     * @param services 요청된 서비스 이름
     * @return PENDING 상태 ReleaseRecord
     */
    public static ReleaseRecord pending(ReleaseId releaseId, String releaseName, Environment environment,
                                        Instant timestamp, List<ServiceName> services) {
        return new ReleaseRecord(releaseId, releaseName, environment, timestamp, ReleaseState.PENDING,
            services, List.of(), List.of(), 0, HealthStatus.HEALTHY, null);
    }

    /**
     * 부분 갱신 적용.
     *
     * <p>update에 값이 있는 필드만 바뀝니다. 상태가 포함된 경우 {@link StateTransition} 규칙을 따릅니다.</p>
     *
     * @param update 부분 갱신
     * @return 갱신된 새 ReleaseRecord
     * @throws IllegalArgumentException update가 null인 경우
     * @throws IllegalStateException 종료 상태 기록을 변경하거나 허용되지 않은 전이인 경우
     */
    public ReleaseRecord apply(ReleaseUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(
                "Release " + releaseId.getValue() + " is already finalized with state: " + status);
        }
        ReleaseState nextStatus = status;
        if (update.status() != null) {
            nextStatus = StateTransition.transition(status, update.status());
        }
        return new ReleaseRecord(
            releaseId,
            releaseName,
            environment,
            timestamp,
            nextStatus,
            services,
            update.deploymentOrder() != null ? update.deploymentOrder() : deploymentOrder,
            update.serviceResults() != null ? update.serviceResults() : serviceResults,
            update.durationMs() != null ? update.durationMs() : durationMs,
            update.overallHealth() != null ? update.overallHealth() : overallHealth,
            update.releaseNotesPath() != null ? update.releaseNotesPath() : releaseNotesPath
        );
    }
}
