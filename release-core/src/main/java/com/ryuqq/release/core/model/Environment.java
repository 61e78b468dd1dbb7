package com.ryuqq.release.core.model;

import com.ryuqq.release.core.exception.ValidationException;

/**
 * 릴리스 대상 환경.
 *
 * <p>staging, production 두 가지만 허용되며, 그 외 값은 어떤 부수효과보다 먼저 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Environment {

    STAGING("staging"),

    PRODUCTION("production");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    /**
     * 외부 표현 값 (예: "staging").
     *
     * @return 환경 값
     */
    public String value() {
        return value;
    }

    /**
     * 외부 표현 값으로부터 Environment 조회.
     *
     * @param value 환경 값 ("staging" 또는 "production")
     * @return Environment
     * @throws ValidationException 허용되지 않은 값인 경우
     */
    public static Environment fromValue(String value) {
        for (Environment environment : values()) {
            if (environment.value.equals(value)) {
                return environment;
            }
        }
        throw new ValidationException(
            "Unsupported environment '" + value + "' (allowed: staging, production)");
    }
}
