package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.core.graph.Batch;
import com.ryuqq.release.core.graph.DependencyGraph;
import com.ryuqq.release.core.graph.TopologicalSorter;
import com.ryuqq.release.core.model.DeploymentStrategy;
import com.ryuqq.release.core.model.ServiceDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * 배포 전략별 배치 계획.
 *
 * <ul>
 *   <li>SEQUENTIAL: 입력 순서대로 서비스 하나씩 배치 (의존성은 검증에만 사용)</li>
 *   <li>PARALLEL: 모든 서비스를 하나의 배치로 (의존성은 검증에만 사용)</li>
 *   <li>DEPENDENCY_ORDER: {@link TopologicalSorter} 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchPlanner {

    // Utility class - prevent instantiation
    private BatchPlanner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 배치 계획 수립.
     *
     * @param strategy 배포 전략
     * @param graph 검증과 순환 탐지를 통과한 그래프
     * @return 실행 순서대로의 배치 목록
     * @throws IllegalArgumentException strategy 또는 graph가 null인 경우
     */
    public static List<Batch> plan(DeploymentStrategy strategy, DependencyGraph graph) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (graph.size() == 0) {
            return List.of();
        }

        return switch (strategy) {
            case SEQUENTIAL -> sequential(graph);
            case PARALLEL -> List.of(new Batch(1, new ArrayList<>(graph.nodes().values()), List.of()));
            case DEPENDENCY_ORDER -> TopologicalSorter.topologicalSort(graph);
        };
    }

    private static List<Batch> sequential(DependencyGraph graph) {
        List<Batch> batches = new ArrayList<>();
        for (ServiceDeclaration service : graph.nodes().values()) {
            int id = batches.size() + 1;
            List<Integer> dependsOn = id == 1 ? List.of() : List.of(id - 1);
            batches.add(new Batch(id, List.of(service), dependsOn));
        }
        return batches;
    }
}
