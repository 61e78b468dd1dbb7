package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 서비스 의존성 그래프.
 *
 * <p>노드와 간선을 이름 키 맵으로만 표현합니다 (서비스 객체 간 상호 참조 없음).
 * 모든 맵은 입력 순서를 유지하는 불변 맵이며, {@link DependencyGraphBuilder}로만 생성됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 간선의 양 끝점은 nodes에 존재</li>
 *   <li>forwardEdges와 reverseEdges는 정확히 서로의 역</li>
 * </ul>
 *
 * @param nodes 이름 → 서비스 선언
 * @param forwardEdges 이름 → 의존하는 서비스들 ("depends on")
 * @param reverseEdges 이름 → 이 서비스에 의존하는 서비스들 ("is depended on by")
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DependencyGraph(
    Map<ServiceName, ServiceDeclaration> nodes,
    Map<ServiceName, Set<ServiceName>> forwardEdges,
    Map<ServiceName, Set<ServiceName>> reverseEdges
) {

    public DependencyGraph {
        if (nodes == null || forwardEdges == null || reverseEdges == null) {
            throw new IllegalArgumentException("graph maps cannot be null");
        }
    }

    /**
     * 서비스의 의존 대상.
     *
     * @param service 서비스 이름
     * @return 의존 대상 (없으면 빈 집합)
     */
    public Set<ServiceName> dependenciesOf(ServiceName service) {
        return forwardEdges.getOrDefault(service, Set.of());
    }

    /**
     * 서비스에 의존하는 서비스들.
     *
     * @param service 서비스 이름
     * @return 의존자 (없으면 빈 집합)
     */
    public Set<ServiceName> dependentsOf(ServiceName service) {
        return reverseEdges.getOrDefault(service, Set.of());
    }

    /**
     * 입력 순서의 노드 이름 목록.
     *
     * @return 노드 이름
     */
    public List<ServiceName> serviceNames() {
        return new ArrayList<>(nodes.keySet());
    }

    public ServiceDeclaration get(ServiceName service) {
        return nodes.get(service);
    }

    public int size() {
        return nodes.size();
    }
}
