package com.ryuqq.release.core.model;

import com.ryuqq.release.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 모델 enum의 wire 값 파싱 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ModelEnumTest {

    @Test
    void environment_UnsupportedValue_ThrowsValidationException() {
        // When & Then
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> Environment.fromValue("qa")
        );
        assertTrue(exception.getMessage().contains("'qa'"));
        assertEquals(Environment.PRODUCTION, Environment.fromValue("production"));
    }

    @Test
    void strategy_NullValue_DefaultsToDependencyOrder() {
        // When & Then
        assertEquals(DeploymentStrategy.DEPENDENCY_ORDER, DeploymentStrategy.fromValue(null));
        assertEquals(DeploymentStrategy.PARALLEL, DeploymentStrategy.fromValue("parallel"));
        assertEquals(DeploymentStrategy.DEPENDENCY_ORDER, DeploymentStrategy.fromValue("dependency-order"));
    }

    @Test
    void strategy_UnknownValue_ThrowsValidationException() {
        // When & Then
        assertThrows(ValidationException.class, () -> DeploymentStrategy.fromValue("canary"));
    }

    @Test
    void serviceStatus_WireValues() {
        // When & Then
        assertEquals("rolled-back", ServiceStatus.ROLLED_BACK.value());
        assertEquals(ServiceStatus.SKIPPED, ServiceStatus.fromValue("skipped"));
        assertFalse(ServiceStatus.SKIPPED.wasAttempted());
        assertTrue(ServiceStatus.FAILED.wasAttempted());
    }

    @Test
    void serviceDeclaration_KeepsDependencyOrderAndRejectsBadTimeout() {
        // Given
        ServiceDeclaration declaration = ServiceDeclaration.of("api", "2.0.0", "db", "cache", "db");

        // When & Then
        assertEquals("[db, cache]", declaration.dependencies().toString());
        assertTrue(declaration.timeoutIfSet().isEmpty());
        assertThrows(IllegalArgumentException.class,
            () -> declaration.withTimeout(java.time.Duration.ZERO));
    }
}
