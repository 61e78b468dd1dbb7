package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.model.ServiceName;

/**
 * 의존성 선언 오류 한 건.
 *
 * @param kind 오류 종류
 * @param service 오류를 가진 서비스
 * @param reference 문제가 된 참조 (MISSING_DEPENDENCY만 사용, 그 외 null)
 * @param occurrences 같은 이름의 등장 횟수 (DUPLICATE_NAME만 사용, 그 외 1)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DependencyError(
    Kind kind,
    ServiceName service,
    ServiceName reference,
    int occurrences
) {

    /**
     * 오류 종류.
     */
    public enum Kind {
        MISSING_DEPENDENCY,
        SELF_DEPENDENCY,
        DUPLICATE_NAME
    }

    public DependencyError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (kind == Kind.MISSING_DEPENDENCY && reference == null) {
            throw new IllegalArgumentException("reference is required for MISSING_DEPENDENCY");
        }
    }

    public static DependencyError missing(ServiceName service, ServiceName reference) {
        return new DependencyError(Kind.MISSING_DEPENDENCY, service, reference, 1);
    }

    public static DependencyError self(ServiceName service) {
        return new DependencyError(Kind.SELF_DEPENDENCY, service, null, 1);
    }

    public static DependencyError duplicate(ServiceName service, int occurrences) {
        return new DependencyError(Kind.DUPLICATE_NAME, service, null, occurrences);
    }

    /**
     * 사람이 읽을 수 있는 메시지 (관련된 서비스 이름을 모두 포함).
     *
     * @return 오류 메시지
     */
    public String message() {
        return switch (kind) {
            case MISSING_DEPENDENCY -> String.format(
                "Service '%s' depends on '%s', but '%s' is not defined", service, reference, reference);
            case SELF_DEPENDENCY -> String.format("Service '%s' has a self-dependency", service);
            case DUPLICATE_NAME -> String.format(
                "Duplicate service name: '%s' appears %d times", service, occurrences);
        };
    }
}
