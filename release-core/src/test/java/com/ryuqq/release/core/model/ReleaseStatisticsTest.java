package com.ryuqq.release.core.model;

import com.ryuqq.release.core.statemachine.ReleaseState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReleaseStatistics 계산 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReleaseStatisticsTest {

    private static ReleaseRecord record(String id, ReleaseState status, long durationMs) {
        return new ReleaseRecord(ReleaseId.of(id), id, Environment.STAGING, Instant.EPOCH, status,
            List.of(), List.of(), List.of(), durationMs, HealthStatus.HEALTHY, null);
    }

    @Test
    void from_MixedStatuses_CountsEachBucket() {
        // Given
        List<ReleaseRecord> records = List.of(
            record("r-1", ReleaseState.SUCCESS, 100),
            record("r-2", ReleaseState.SUCCESS, 300),
            record("r-3", ReleaseState.FAILED, 200),
            record("r-4", ReleaseState.ROLLED_BACK, 400),
            record("r-5", ReleaseState.IN_PROGRESS, 0)
        );

        // When
        ReleaseStatistics statistics = ReleaseStatistics.from(records);

        // Then
        assertEquals(5, statistics.total());
        assertEquals(2, statistics.successful());
        assertEquals(1, statistics.failed());
        assertEquals(1, statistics.rolledBack());
        assertEquals(1, statistics.inProgress());
        assertEquals(4, statistics.finished());
        assertEquals(0.4, statistics.successRate(), 1e-9);
        assertEquals(200.0, statistics.averageDurationMs(), 1e-9);
    }

    @Test
    void from_NoRecords_EqualsEmpty() {
        // When & Then
        assertEquals(ReleaseStatistics.empty(), ReleaseStatistics.from(List.of()));
    }
}
