package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TopologicalSorter 테스트.
 *
 * <ul>
 *   <li>다이아몬드 그래프 배치 계산</li>
 *   <li>모든 서비스가 정확히 한 배치에 포함</li>
 *   <li>의존 대상은 항상 더 앞선 배치</li>
 *   <li>순환이 남으면 부분 결과 없이 예외</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TopologicalSorterTest {

    private static List<ServiceName> names(String... values) {
        return Arrays.stream(values).map(ServiceName::of).toList();
    }

    @Test
    void topologicalSort_Diamond_ThreeLevels() {
        // Given
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(List.of(
            ServiceDeclaration.of("A", "1.0.0", "B", "C"),
            ServiceDeclaration.of("B", "1.0.0", "D"),
            ServiceDeclaration.of("C", "1.0.0", "D"),
            ServiceDeclaration.of("D", "1.0.0")
        ));

        // When
        List<Batch> batches = TopologicalSorter.topologicalSort(graph);

        // Then
        assertEquals(3, batches.size());
        assertEquals(names("D"), batches.get(0).serviceNames());
        assertEquals(names("B", "C"), batches.get(1).serviceNames());
        assertEquals(names("A"), batches.get(2).serviceNames());

        assertEquals(List.of(1, 2, 3), batches.stream().map(Batch::id).toList());
        assertEquals(List.of(), batches.get(0).dependsOnBatchIds());
        assertEquals(List.of(1), batches.get(1).dependsOnBatchIds());
        assertEquals(List.of(2), batches.get(2).dependsOnBatchIds());
    }

    @Test
    void topologicalSort_BatchMembers_FollowInputOrder() {
        // Given
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(List.of(
            ServiceDeclaration.of("zeta", "1.0.0"),
            ServiceDeclaration.of("alpha", "1.0.0"),
            ServiceDeclaration.of("mid", "1.0.0", "zeta", "alpha")
        ));

        // When
        List<Batch> batches = TopologicalSorter.topologicalSort(graph);

        // Then
        assertEquals(names("zeta", "alpha"), batches.get(0).serviceNames());
        assertEquals(names("mid"), batches.get(1).serviceNames());
    }

    @Test
    void topologicalSort_LayeredGraph_PartitionsAndOrdersEveryEdge() {
        // Given
        List<ServiceDeclaration> services = List.of(
            ServiceDeclaration.of("web", "1.0.0", "api", "cdn"),
            ServiceDeclaration.of("api", "1.0.0", "db", "cache", "auth"),
            ServiceDeclaration.of("auth", "1.0.0", "db"),
            ServiceDeclaration.of("cache", "1.0.0"),
            ServiceDeclaration.of("db", "1.0.0"),
            ServiceDeclaration.of("cdn", "1.0.0"),
            ServiceDeclaration.of("worker", "1.0.0", "db", "queue"),
            ServiceDeclaration.of("queue", "1.0.0")
        );
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(services);

        // When
        List<Batch> batches = TopologicalSorter.topologicalSort(graph);

        // Then
        Map<ServiceName, Integer> batchIndex = new HashMap<>();
        for (int i = 0; i < batches.size(); i++) {
            for (ServiceName service : batches.get(i).serviceNames()) {
                assertNull(batchIndex.put(service, i), "service appears in more than one batch: " + service);
            }
        }
        assertEquals(services.size(), batchIndex.size());

        for (ServiceDeclaration service : services) {
            for (ServiceName dependency : service.dependencies()) {
                assertTrue(batchIndex.get(dependency) < batchIndex.get(service.name()),
                    dependency + " must be deployed before " + service.name());
            }
        }
        assertEquals(names("cache", "db", "cdn", "queue"), batches.get(0).serviceNames());
        assertEquals(names("auth", "worker"), batches.get(1).serviceNames());
        assertEquals(names("api"), batches.get(2).serviceNames());
        assertEquals(names("web"), batches.get(3).serviceNames());
        assertEquals(List.of(1, 3), batches.get(3).dependsOnBatchIds());
    }

    @Test
    void topologicalSort_EmptyGraph_ReturnsNoBatches() {
        // When & Then
        assertTrue(TopologicalSorter.topologicalSort(DependencyGraphBuilder.buildGraph(List.of())).isEmpty());
    }

    @Test
    void topologicalSort_CyclicGraph_ThrowsWithResidualServices() {
        // Given
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(List.of(
            ServiceDeclaration.of("root", "1.0.0"),
            ServiceDeclaration.of("A", "1.0.0", "B", "root"),
            ServiceDeclaration.of("B", "1.0.0", "A")
        ));

        // When & Then
        ValidationException exception = assertThrows(
            ValidationException.class,
            () -> TopologicalSorter.topologicalSort(graph)
        );
        assertTrue(exception.getMessage().contains("[A, B]"));
        assertFalse(exception.getMessage().contains("root"));
    }
}
