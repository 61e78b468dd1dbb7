package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.model.ServiceStatus;

import java.util.Collection;

/**
 * 서비스 결과로부터 릴리스 전체 헬스 판정.
 *
 * <ul>
 *   <li>UNHEALTHY: FAILED로 끝난 서비스가 하나라도 있음</li>
 *   <li>DEGRADED: 실패는 없지만 시도된 서비스 중 HEALTHY가 아닌 헬스를 보고했거나 롤백된 서비스가 있음</li>
 *   <li>HEALTHY: 시도된 모든 서비스가 HEALTHY로 성공</li>
 * </ul>
 *
 * <p>시도되지 않은(SKIPPED) 서비스는 판정에서 제외되며, 결과는 UNKNOWN이 되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HealthAggregator {

    // Utility class - prevent instantiation
    private HealthAggregator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static HealthStatus aggregate(Collection<ServiceResult> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }

        boolean degraded = false;
        for (ServiceResult result : results) {
            if (result.status() == ServiceStatus.FAILED) {
                return HealthStatus.UNHEALTHY;
            }
            if (!result.status().wasAttempted()) {
                continue;
            }
            if (result.status() == ServiceStatus.ROLLED_BACK || result.healthStatus() != HealthStatus.HEALTHY) {
                degraded = true;
            }
        }
        return degraded ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }
}
