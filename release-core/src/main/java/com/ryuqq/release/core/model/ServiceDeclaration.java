package com.ryuqq.release.core.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 릴리스에 포함될 서비스 선언.
 *
 * <p>dependencies는 같은 요청 안의 다른 서비스 이름을 참조해야 합니다.
 * 자기 참조, 누락된 참조, 중복 이름은 이 record가 아니라 의존성 검증 단계에서
 * 한 번에 모두 수집되어 보고됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ServiceDeclaration api = ServiceDeclaration.of("api", "2.1.0", "db", "cache")
 *     .withTimeout(Duration.ofMinutes(5));
 * </pre>
 *
 * @param name 서비스 이름 (요청 내 고유 키)
 * @param version 배포할 버전
 * @param dependencies 선행 배포가 필요한 서비스 이름 (선언 순서 유지)
 * @param config 실행자에게 그대로 전달되는 설정 (불투명)
 * @param timeout 서비스별 배포 타임아웃 (null이면 코디네이터 기본값)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServiceDeclaration(
    ServiceName name,
    String version,
    Set<ServiceName> dependencies,
    Map<String, Object> config,
    Duration timeout
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name/version이 null이거나 timeout이 음수/0인 경우
     */
    public ServiceDeclaration {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        dependencies = dependencies == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        config = config == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * 설정/타임아웃 없이 생성.
     *
     * @param name 서비스 이름
     * @param version 버전
     * @param dependencies 의존 서비스 이름들
     * @return ServiceDeclaration
     */
    public static ServiceDeclaration of(String name, String version, String... dependencies) {
        return of(name, version, Arrays.asList(dependencies));
    }

    /**
     * 설정/타임아웃 없이 생성.
     *
     * @param name 서비스 이름
     * @param version 버전
     * @param dependencies 의존 서비스 이름들
     * @return ServiceDeclaration
     */
    public static ServiceDeclaration of(String name, String version, Collection<String> dependencies) {
        Set<ServiceName> names = new LinkedHashSet<>();
        for (String dependency : dependencies) {
            names.add(ServiceName.of(dependency));
        }
        return new ServiceDeclaration(ServiceName.of(name), version, names, null, null);
    }

    /**
     * config만 변경한 새 인스턴스 생성.
     */
    public ServiceDeclaration withConfig(Map<String, Object> config) {
        return new ServiceDeclaration(name, version, dependencies, config, timeout);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public ServiceDeclaration withTimeout(Duration timeout) {
        return new ServiceDeclaration(name, version, dependencies, config, timeout);
    }

    /**
     * 서비스별 타임아웃 조회.
     *
     * @return 설정된 타임아웃 (없으면 empty)
     */
    public Optional<Duration> timeoutIfSet() {
        return Optional.ofNullable(timeout);
    }

    /**
     * 특정 서비스에 의존하는지 확인.
     *
     * @param other 대상 서비스 이름
     * @return 의존하면 true
     */
    public boolean dependsOn(ServiceName other) {
        return dependencies.contains(other);
    }
}
