package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 서비스 선언 목록으로부터 의존성 그래프를 만들고 검증.
 *
 * <p><strong>검증 항목 (한 번의 순회로 모두 수집):</strong></p>
 * <ul>
 *   <li>중복 서비스 이름</li>
 *   <li>요청에 없는 서비스에 대한 의존 (누락 참조)</li>
 *   <li>자기 자신에 대한 의존</li>
 * </ul>
 *
 * <p>순환 의존성은 {@link CycleDetector}가 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyGraphBuilder {

    // Utility class - prevent instantiation
    private DependencyGraphBuilder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 의존성 그래프 생성.
     *
     * <p>검증 오류가 하나라도 있으면 그래프를 만들지 않고 모든 오류를 담아 예외를 던집니다.
     * 따라서 반환된 그래프의 모든 간선 끝점은 항상 nodes에 존재합니다.</p>
     *
     * @param services 서비스 선언 목록
     * @return 의존성 그래프
     * @throws IllegalArgumentException services가 null인 경우
     * @throws ValidationException 중복 이름, 누락 참조, 자기 참조가 있는 경우
     */
    public static DependencyGraph buildGraph(List<ServiceDeclaration> services) {
        validateDependencies(services).throwIfInvalid();

        Map<ServiceName, ServiceDeclaration> nodes = new LinkedHashMap<>();
        Map<ServiceName, Set<ServiceName>> forward = new LinkedHashMap<>();
        Map<ServiceName, Set<ServiceName>> reverse = new LinkedHashMap<>();

        for (ServiceDeclaration service : services) {
            nodes.put(service.name(), service);
            forward.put(service.name(), new LinkedHashSet<>());
            reverse.put(service.name(), new LinkedHashSet<>());
        }

        for (ServiceDeclaration service : services) {
            for (ServiceName dependency : service.dependencies()) {
                forward.get(service.name()).add(dependency);
                reverse.get(dependency).add(service.name());
            }
        }

        return new DependencyGraph(
            Collections.unmodifiableMap(nodes),
            freeze(forward),
            freeze(reverse)
        );
    }

    /**
     * 의존성 검증 (예외 없음).
     *
     * <p>입력에만 의존하는 순수 함수입니다. 오류는 다음 순서로 보고됩니다:</p>
     * <ol>
     *   <li>중복 이름 (처음 등장한 순서, 이름당 1회)</li>
     *   <li>서비스별 누락 참조 (입력 순서, 선언 순서)</li>
     *   <li>서비스별 자기 참조</li>
     * </ol>
     *
     * @param services 서비스 선언 목록
     * @return 검증 결과
     * @throws IllegalArgumentException services가 null이거나 null 원소를 포함한 경우
     */
    public static ValidationResult validateDependencies(List<ServiceDeclaration> services) {
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        if (services.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("services cannot contain null elements");
        }

        Set<DependencyError> errors = new LinkedHashSet<>();

        Map<ServiceName, Integer> nameCounts = new LinkedHashMap<>();
        for (ServiceDeclaration service : services) {
            nameCounts.merge(service.name(), 1, Integer::sum);
        }
        for (Map.Entry<ServiceName, Integer> entry : nameCounts.entrySet()) {
            if (entry.getValue() > 1) {
                errors.add(DependencyError.duplicate(entry.getKey(), entry.getValue()));
            }
        }

        Set<ServiceName> declared = nameCounts.keySet();
        for (ServiceDeclaration service : services) {
            for (ServiceName dependency : service.dependencies()) {
                if (!declared.contains(dependency)) {
                    errors.add(DependencyError.missing(service.name(), dependency));
                }
            }
        }
        for (ServiceDeclaration service : services) {
            if (service.dependsOn(service.name())) {
                errors.add(DependencyError.self(service.name()));
            }
        }

        return new ValidationResult(new ArrayList<>(errors), isolatedServiceWarnings(services));
    }

    /**
     * 의존 대상도 없고 의존자도 없는 서비스에 대한 경고 (서비스가 2개 이상일 때만).
     */
    private static List<String> isolatedServiceWarnings(List<ServiceDeclaration> services) {
        if (services.size() <= 1) {
            return List.of();
        }
        Set<ServiceName> referenced = new HashSet<>();
        for (ServiceDeclaration service : services) {
            referenced.addAll(service.dependencies());
        }
        List<String> warnings = new ArrayList<>();
        for (ServiceDeclaration service : services) {
            if (service.dependencies().isEmpty() && !referenced.contains(service.name())) {
                warnings.add(String.format(
                    "Service '%s' has no dependencies and is not a dependency of any other service", service.name()));
            }
        }
        return warnings;
    }

    private static Map<ServiceName, Set<ServiceName>> freeze(Map<ServiceName, Set<ServiceName>> edges) {
        Map<ServiceName, Set<ServiceName>> frozen = new LinkedHashMap<>();
        edges.forEach((name, targets) -> frozen.put(name, Collections.unmodifiableSet(targets)));
        return Collections.unmodifiableMap(frozen);
    }
}
