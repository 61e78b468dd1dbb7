package com.ryuqq.release.core.model;

import com.ryuqq.release.core.exception.ValidationException;

/**
 * 배치 계획 전략.
 *
 * <ul>
 *   <li>{@link #SEQUENTIAL}: 입력 순서대로 서비스 하나씩 (배치당 1개)</li>
 *   <li>{@link #PARALLEL}: 모든 서비스를 단일 배치로 동시 배포</li>
 *   <li>{@link #DEPENDENCY_ORDER}: 위상 정렬 레벨 단위 배치 (기본값)</li>
 * </ul>
 *
 * <p>어떤 전략이든 의존성 검증은 항상 수행됩니다.
 * SEQUENTIAL, PARALLEL은 의존성을 순서 결정에 사용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeploymentStrategy {

    SEQUENTIAL("sequential"),

    PARALLEL("parallel"),

    DEPENDENCY_ORDER("dependency-order");

    private final String value;

    DeploymentStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 기본 전략.
     *
     * @return DEPENDENCY_ORDER
     */
    public static DeploymentStrategy defaultStrategy() {
        return DEPENDENCY_ORDER;
    }

    /**
     * 외부 표현 값으로부터 전략 조회.
     *
     * @param value 전략 값 (null이면 기본 전략)
     * @return DeploymentStrategy
     * @throws ValidationException 허용되지 않은 값인 경우
     */
    public static DeploymentStrategy fromValue(String value) {
        if (value == null) {
            return defaultStrategy();
        }
        for (DeploymentStrategy strategy : values()) {
            if (strategy.value.equals(value)) {
                return strategy;
            }
        }
        throw new ValidationException(
            "Unsupported strategy '" + value + "' (allowed: sequential, parallel, dependency-order)");
    }
}
