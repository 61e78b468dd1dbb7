package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Kahn 알고리즘 기반 위상 정렬 (레벨 단위 배치).
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>진입 차수 = 서비스별 의존 대상 수</li>
 *   <li>진입 차수 0인 노드를 모두 모아 다음 배치로 만든다</li>
 *   <li>배치의 노드를 제거하고 그 의존자들의 진입 차수를 감소</li>
 *   <li>남은 노드가 없을 때까지 반복</li>
 * </ol>
 *
 * <p>배치 내 순서는 원래 입력 순서를 따르므로, 같은 입력에 대해 항상 같은 결과를 냅니다.</p>
 *
 * <p><strong>전제 조건:</strong> 그래프에 순환이 없어야 합니다 ({@link CycleDetector}로 먼저 확인).
 * 전제가 깨지면 부분 결과를 반환하지 않고 처리되지 못한 서비스를 담아 예외를 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TopologicalSorter {

    // Utility class - prevent instantiation
    private TopologicalSorter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 의존성 순서를 지키는 배치 목록 계산.
     *
     * @param graph 순환이 없는 의존성 그래프
     * @return 실행 순서대로의 배치 목록 (빈 그래프면 빈 목록)
     * @throws IllegalArgumentException graph가 null인 경우
     * @throws ValidationException 순환 때문에 정렬되지 않은 서비스가 남은 경우
     */
    public static List<Batch> topologicalSort(DependencyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }

        Map<ServiceName, Integer> inputIndex = new HashMap<>();
        Map<ServiceName, Integer> inDegree = new HashMap<>();
        List<ServiceName> current = new ArrayList<>();
        for (ServiceName node : graph.nodes().keySet()) {
            inputIndex.put(node, inputIndex.size());
            int degree = graph.dependenciesOf(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                current.add(node);
            }
        }

        Comparator<ServiceName> byInputOrder = Comparator.comparing(inputIndex::get);
        Map<ServiceName, Integer> batchOf = new HashMap<>();
        List<Batch> batches = new ArrayList<>();

        while (!current.isEmpty()) {
            int batchId = batches.size() + 1;
            List<ServiceDeclaration> members = new ArrayList<>();
            TreeSet<Integer> dependsOn = new TreeSet<>();

            for (ServiceName node : current) {
                members.add(graph.get(node));
                batchOf.put(node, batchId);
                for (ServiceName dependency : graph.dependenciesOf(node)) {
                    dependsOn.add(batchOf.get(dependency));
                }
            }
            batches.add(new Batch(batchId, members, new ArrayList<>(dependsOn)));

            List<ServiceName> next = new ArrayList<>();
            for (ServiceName node : current) {
                for (ServiceName dependent : graph.dependentsOf(node)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependent);
                    }
                }
            }
            next.sort(byInputOrder);
            current = next;
        }

        if (batchOf.size() != graph.size()) {
            List<String> residual = graph.nodes().keySet().stream()
                .filter(node -> !batchOf.containsKey(node))
                .map(ServiceName::getValue)
                .toList();
            throw new ValidationException(
                "Topological sort failed: services left unordered by a circular dependency: " + residual);
        }
        return batches;
    }
}
