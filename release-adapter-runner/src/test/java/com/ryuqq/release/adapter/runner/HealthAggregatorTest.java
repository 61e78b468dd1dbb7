package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ServiceName;
import com.ryuqq.release.core.model.ServiceResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HealthAggregator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HealthAggregatorTest {

    private static ServiceResult ok(String name, HealthStatus health) {
        return ServiceResult.success(ServiceName.of(name), "d-" + name, "1.0.0", 5, health);
    }

    @Test
    void 모두_HEALTHY_성공이면_HEALTHY() {
        assertThat(HealthAggregator.aggregate(List.of(ok("a", HealthStatus.HEALTHY), ok("b", HealthStatus.HEALTHY))))
            .isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void 성공했지만_DEGRADED_보고가_있으면_DEGRADED() {
        assertThat(HealthAggregator.aggregate(List.of(ok("a", HealthStatus.HEALTHY), ok("b", HealthStatus.DEGRADED))))
            .isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void 실패가_하나라도_있으면_UNHEALTHY() {
        // given
        List<ServiceResult> results = List.of(
            ok("a", HealthStatus.HEALTHY),
            ServiceResult.failed(ServiceName.of("b"), null, "1.0.0", 3, "boom"),
            ServiceResult.skipped(ServiceName.of("c"), "1.0.0")
        );

        // when & then
        assertThat(HealthAggregator.aggregate(results)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void 롤백된_서비스가_있고_실패가_없으면_DEGRADED() {
        assertThat(HealthAggregator.aggregate(List.of(ok("a", HealthStatus.HEALTHY).rolledBack("release failed"))))
            .isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void 시도되지_않은_서비스의_UNKNOWN은_무시() {
        assertThat(HealthAggregator.aggregate(List.of(
            ok("a", HealthStatus.HEALTHY),
            ServiceResult.skipped(ServiceName.of("b"), "1.0.0"))))
            .isEqualTo(HealthStatus.HEALTHY);
    }
}
