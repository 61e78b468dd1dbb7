package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DependencyGraphBuilder 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DependencyGraphBuilderTest {

    private static ServiceName name(String value) {
        return ServiceName.of(value);
    }

    // ========== buildGraph ==========

    @Test
    void buildGraph_Diamond_ForwardAndReverseEdgesAreInverse() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("A", "1.0.0", "B", "C"),
            ServiceDeclaration.of("B", "1.0.0", "D"),
            ServiceDeclaration.of("C", "1.0.0", "D"),
            ServiceDeclaration.of("D", "1.0.0")
        );

        // When
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(services);

        // Then
        assertEquals(4, graph.size());
        assertEquals(List.of(name("A"), name("B"), name("C"), name("D")), graph.serviceNames());
        assertEquals(List.of(name("B"), name("C")), List.copyOf(graph.dependenciesOf(name("A"))));
        assertEquals(List.of(name("B"), name("C")), List.copyOf(graph.dependentsOf(name("D"))));
        assertTrue(graph.dependenciesOf(name("D")).isEmpty());

        for (ServiceName from : graph.serviceNames()) {
            for (ServiceName to : graph.dependenciesOf(from)) {
                assertTrue(graph.dependentsOf(to).contains(from));
            }
            for (ServiceName dependent : graph.dependentsOf(from)) {
                assertTrue(graph.dependenciesOf(dependent).contains(from));
            }
        }
    }

    @Test
    void buildGraph_EmptyList_ReturnsEmptyGraph() {
        // When
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(List.of());

        // Then
        assertEquals(0, graph.size());
    }

    @Test
    void buildGraph_ResultIsUnmodifiable() {
        // Given
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(List.of(
            ServiceDeclaration.of("A", "1.0.0", "B"),
            ServiceDeclaration.of("B", "1.0.0")
        ));

        // When & Then
        assertThrows(UnsupportedOperationException.class,
            () -> graph.dependenciesOf(name("A")).add(name("C")));
        assertThrows(UnsupportedOperationException.class,
            () -> graph.nodes().remove(name("A")));
    }

    @Test
    void buildGraph_DuplicateName_ThrowsValidationException() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("A", "1.0.0"),
            ServiceDeclaration.of("A", "2.0.0")
        );

        // When & Then
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> DependencyGraphBuilder.buildGraph(services)
        );
        assertTrue(exception.getMessage().contains("Duplicate service name: 'A'"));
    }

    @Test
    void buildGraph_MissingDependency_ThrowsValidationException() {
        // Given
        List<ServiceDeclaration> services = List.of(ServiceDeclaration.of("A", "1.0.0", "ghost"));

        // When & Then
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> DependencyGraphBuilder.buildGraph(services)
        );
        assertEquals(1, exception.getErrors().size());
        assertTrue(exception.getErrors().get(0).contains("'A'"));
        assertTrue(exception.getErrors().get(0).contains("'ghost'"));
    }

    @Test
    void buildGraph_CyclicInput_StillBuildsGraph() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("A", "1.0.0", "B"),
            ServiceDeclaration.of("B", "1.0.0", "A")
        );

        // When
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(services);

        // Then
        assertEquals(2, graph.size());
    }

    // ========== validateDependencies ==========

    @Test
    void validateDependencies_ValidInput_NoErrors() {
        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(List.of(
            ServiceDeclaration.of("api", "1.0.0", "db"),
            ServiceDeclaration.of("db", "1.0.0")
        ));

        // Then
        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
        assertDoesNotThrow(result::throwIfInvalid);
    }

    @Test
    void validateDependencies_CollectsEveryErrorInOnePass() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("A", "1.0.0", "ghost"),
            ServiceDeclaration.of("B", "1.0.0", "B"),
            ServiceDeclaration.of("C", "1.0.0"),
            ServiceDeclaration.of("C", "1.0.1", "phantom")
        );

        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(services);

        // Then
        assertFalse(result.valid());
        assertEquals(List.of(
            DependencyError.duplicate(name("C"), 2),
            DependencyError.missing(name("A"), name("ghost")),
            DependencyError.missing(name("C"), name("phantom")),
            DependencyError.self(name("B"))
        ), result.errors());
    }

    @Test
    void validateDependencies_DuplicateReportedOnce() {
        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(List.of(
            ServiceDeclaration.of("A", "1.0.0"),
            ServiceDeclaration.of("A", "1.0.0"),
            ServiceDeclaration.of("A", "1.0.0")
        ));

        // Then
        assertEquals(1, result.errors().size());
        assertEquals("Duplicate service name: 'A' appears 3 times", result.errorMessages().get(0));
    }

    @Test
    void validateDependencies_RepeatedRuns_ProduceIdenticalErrors() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("A", "1.0.0", "ghost", "A"),
            ServiceDeclaration.of("B", "1.0.0", "nowhere")
        );

        // When
        ValidationResult first = DependencyGraphBuilder.validateDependencies(services);
        ValidationResult second = DependencyGraphBuilder.validateDependencies(services);

        // Then
        assertEquals(first, second);
        assertEquals(first.errorMessages(), second.errorMessages());
    }

    @Test
    void validateDependencies_IsolatedServices_ProduceWarningsOnly() {
        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(List.of(
            ServiceDeclaration.of("api", "1.0.0", "db"),
            ServiceDeclaration.of("db", "1.0.0"),
            ServiceDeclaration.of("metrics", "1.0.0")
        ));

        // Then
        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("'metrics'"));
    }

    @Test
    void validateDependencies_SingleService_NoIsolationWarning() {
        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(
            List.of(ServiceDeclaration.of("solo", "1.0.0")));

        // Then
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void validateDependencies_ImmutableList_ValidatesWithoutException() {
        // Given
        List<ServiceDeclaration> services = List.copyOf(List.of(
            ServiceDeclaration.of("A", "1.0.0", "B", "C"),
            ServiceDeclaration.of("B", "1.0.0", "D"),
            ServiceDeclaration.of("C", "1.0.0", "D"),
            ServiceDeclaration.of("D", "1.0.0")
        ));

        // When
        ValidationResult result = DependencyGraphBuilder.validateDependencies(services);

        // Then
        assertTrue(result.valid());
        assertEquals(4, DependencyGraphBuilder.buildGraph(services).size());
        assertTrue(DependencyGraphBuilder.validateDependencies(List.of(ServiceDeclaration.of("solo", "1.0.0"))).valid());
    }

    @Test
    void validateDependencies_NullElement_ThrowsIllegalArgumentException() {
        // Given
        List<ServiceDeclaration> services = Arrays.asList(ServiceDeclaration.of("A", "1.0.0"), null);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyGraphBuilder.validateDependencies(services)
        );
        assertTrue(exception.getMessage().contains("null elements"));
    }

    @Test
    void validateDependencies_NullList_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> DependencyGraphBuilder.validateDependencies(null));
    }
}
