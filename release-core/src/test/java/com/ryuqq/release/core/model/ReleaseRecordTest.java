package com.ryuqq.release.core.model;

import com.ryuqq.release.core.statemachine.ReleaseState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReleaseRecord 부분 갱신 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReleaseRecordTest {

    private static final Instant STARTED_AT = Instant.parse("2026-01-15T10:00:00Z");

    private ReleaseRecord pending() {
        return ReleaseRecord.pending(ReleaseId.of("release-v1"), "v1", Environment.STAGING, STARTED_AT,
            List.of(ServiceName.of("api"), ServiceName.of("db")));
    }

    @Test
    void pending_HasEmptyProgress() {
        // When
        ReleaseRecord record = pending();

        // Then
        assertEquals(ReleaseState.PENDING, record.status());
        assertEquals(HealthStatus.HEALTHY, record.overallHealth());
        assertTrue(record.deploymentOrder().isEmpty());
        assertTrue(record.serviceResults().isEmpty());
        assertNull(record.releaseNotesPath());
    }

    @Test
    void apply_PartialUpdate_ChangesOnlyGivenFields() {
        // Given
        ServiceResult dbResult = ServiceResult.success(ServiceName.of("db"), "dep-1", "1.0.0", 12, HealthStatus.HEALTHY);
        ReleaseRecord inProgress = pending().apply(ReleaseUpdate.builder().status(ReleaseState.IN_PROGRESS).build());

        // When
        ReleaseRecord updated = inProgress.apply(ReleaseUpdate.builder()
            .deploymentOrder(List.of(ServiceName.of("db")))
            .serviceResults(List.of(dbResult))
            .build());

        // Then
        assertEquals(ReleaseState.IN_PROGRESS, updated.status());
        assertEquals(List.of(ServiceName.of("db")), updated.deploymentOrder());
        assertEquals(List.of(dbResult), updated.serviceResults());
        assertEquals(0, updated.durationMs());
        assertEquals(inProgress.services(), updated.services());
        assertEquals(STARTED_AT, updated.timestamp());
    }

    @Test
    void apply_TerminalRecord_ThrowsException() {
        // Given
        ReleaseRecord finished = pending()
            .apply(ReleaseUpdate.builder().status(ReleaseState.IN_PROGRESS).build())
            .apply(ReleaseUpdate.builder().status(ReleaseState.SUCCESS).durationMs(100L).build());

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> finished.apply(ReleaseUpdate.builder().releaseNotesPath("notes.md").build())
        );
        assertTrue(exception.getMessage().contains("already finalized"));
    }

    @Test
    void apply_SkippingInProgress_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class,
            () -> pending().apply(ReleaseUpdate.builder().status(ReleaseState.SUCCESS).build()));
    }

    @Test
    void constructor_UnknownOverallHealth_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ReleaseRecord(
            ReleaseId.of("r-1"), "v1", Environment.PRODUCTION, STARTED_AT, ReleaseState.PENDING,
            List.of(), List.of(), List.of(), 0, HealthStatus.UNKNOWN, null));
    }
}
