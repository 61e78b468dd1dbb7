package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.model.ServiceName;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 순환 의존성 탐지 (DFS + 재귀 스택).
 *
 * <p>DFS 중 현재 스택에 있는 노드를 다시 만나면, 스택에서 그 노드부터 현재 노드까지의 구간에
 * 닫는 노드를 더해 하나의 순환으로 보고합니다.</p>
 *
 * <pre>
 * A → B → C → A  ⇒  [A, B, C, A]
 * </pre>
 *
 * <p>방문하지 않은 모든 노드에서 탐색을 다시 시작하므로 서로 분리된 순환도 모두 찾습니다.
 * 노드/간선 순회는 그래프의 입력 순서를 따르므로 결과는 결정적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CycleDetector {

    // Utility class - prevent instantiation
    private CycleDetector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 순환 경로 탐지.
     *
     * @param graph 의존성 그래프
     * @return 순환 경로 목록 (비순환이면 빈 목록)
     * @throws IllegalArgumentException graph가 null인 경우
     */
    public static List<List<ServiceName>> detectCycles(DependencyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }

        List<List<ServiceName>> cycles = new ArrayList<>();
        Set<ServiceName> visited = new HashSet<>();
        Set<ServiceName> onStack = new HashSet<>();
        List<ServiceName> path = new ArrayList<>();

        for (ServiceName node : graph.nodes().keySet()) {
            if (!visited.contains(node)) {
                dfs(graph, node, visited, onStack, path, cycles);
            }
        }
        return cycles;
    }

    /**
     * 그래프에 순환이 있는지 확인.
     *
     * @param graph 의존성 그래프
     * @return 순환이 하나라도 있으면 true
     */
    public static boolean hasCycles(DependencyGraph graph) {
        return !detectCycles(graph).isEmpty();
    }

    /**
     * 순환 경로를 "A -> B -> C -> A" 형태로 표현.
     *
     * @param cycle 순환 경로
     * @return 문자열 표현
     */
    public static String describe(List<ServiceName> cycle) {
        return cycle.stream().map(ServiceName::getValue).collect(Collectors.joining(" -> "));
    }

    private static void dfs(DependencyGraph graph,
                            ServiceName node,
                            Set<ServiceName> visited,
                            Set<ServiceName> onStack,
                            List<ServiceName> path,
                            List<List<ServiceName>> cycles) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (ServiceName dependency : graph.dependenciesOf(node)) {
            if (onStack.contains(dependency)) {
                List<ServiceName> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency); // 순환 닫기
                cycles.add(List.copyOf(cycle));
            } else if (!visited.contains(dependency)) {
                dfs(graph, dependency, visited, onStack, path, cycles);
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
