package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;

import java.util.List;

/**
 * 동시에 배포할 수 있는 서비스 묶음.
 *
 * <p>배치 안의 서비스들은 서로 독립적이어서 순서 보장 없이 동시에 실행됩니다.
 * 배치 간에는 id 순서대로 엄격히 순차 실행됩니다.</p>
 *
 * @param id 배치 번호 (1부터 시작, 실행 순서)
 * @param services 배치에 속한 서비스 (결정적 순서)
 * @param dependsOnBatchIds 이 배치보다 먼저 끝나야 하는 배치 번호들
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Batch(
    int id,
    List<ServiceDeclaration> services,
    List<Integer> dependsOnBatchIds
) {

    public Batch {
        if (id < 1) {
            throw new IllegalArgumentException("id must be positive (current: " + id + ")");
        }
        if (services == null || services.isEmpty()) {
            throw new IllegalArgumentException("services cannot be null or empty");
        }
        services = List.copyOf(services);
        dependsOnBatchIds = dependsOnBatchIds == null ? List.of() : List.copyOf(dependsOnBatchIds);
    }

    /**
     * 서비스 이름 목록.
     *
     * @return 배치 내 서비스 이름 (services와 같은 순서)
     */
    public List<ServiceName> serviceNames() {
        return services.stream().map(ServiceDeclaration::name).toList();
    }

    public int size() {
        return services.size();
    }
}
