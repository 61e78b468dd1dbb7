package com.ryuqq.release.application.coordinator;

import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.DeploymentStrategy;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ServiceDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 릴리스 요청 파라미터.
 *
 * <p>빌더로만 생성되며, build() 시점에 요청 자체의 형식 오류를 검사합니다.
 * 서비스 간 의존성 오류는 코디네이터의 검증 단계에서 보고됩니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>strategy: {@link DeploymentStrategy#DEPENDENCY_ORDER}</li>
 *   <li>rollbackOnFailure: false</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CoordinateReleaseParams {

    private final String releaseName;
    private final Environment environment;
    private final List<ServiceDeclaration> services;
    private final DeploymentStrategy strategy;
    private final boolean rollbackOnFailure;

    private CoordinateReleaseParams(Builder builder) {
        this.releaseName = builder.releaseName;
        this.environment = builder.environment;
        this.services = List.copyOf(builder.services);
        this.strategy = builder.strategy;
        this.rollbackOnFailure = builder.rollbackOnFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getReleaseName() {
        return releaseName;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public List<ServiceDeclaration> getServices() {
        return services;
    }

    public DeploymentStrategy getStrategy() {
        return strategy;
    }

    public boolean isRollbackOnFailure() {
        return rollbackOnFailure;
    }

    @Override
    public String toString() {
        return "CoordinateReleaseParams{" +
            "releaseName='" + releaseName + '\'' +
            ", environment=" + environment +
            ", services=" + services.size() +
            ", strategy=" + strategy +
            ", rollbackOnFailure=" + rollbackOnFailure +
            '}';
    }

    /**
     * CoordinateReleaseParams 빌더.
     *
     * <p>문자열 environment/strategy는 wire 값("staging", "dependency-order" 등)으로 해석됩니다.</p>
     */
    public static final class Builder {

        private String releaseName;
        private Environment environment;
        private final List<ServiceDeclaration> services = new ArrayList<>();
        private DeploymentStrategy strategy = DeploymentStrategy.defaultStrategy();
        private boolean rollbackOnFailure;

        private Builder() {
        }

        public Builder releaseName(String releaseName) {
            this.releaseName = releaseName;
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        /**
         * @throws ValidationException 허용되지 않은 환경 값인 경우
         */
        public Builder environment(String environment) {
            this.environment = Environment.fromValue(environment);
            return this;
        }

        public Builder services(List<ServiceDeclaration> services) {
            this.services.clear();
            if (services != null) {
                this.services.addAll(services);
            }
            return this;
        }

        public Builder service(ServiceDeclaration service) {
            this.services.add(service);
            return this;
        }

        public Builder strategy(DeploymentStrategy strategy) {
            this.strategy = strategy == null ? DeploymentStrategy.defaultStrategy() : strategy;
            return this;
        }

        /**
         * @throws ValidationException 알 수 없는 전략 값인 경우 (null은 기본 전략)
         */
        public Builder strategy(String strategy) {
            this.strategy = DeploymentStrategy.fromValue(strategy);
            return this;
        }

        public Builder rollbackOnFailure(boolean rollbackOnFailure) {
            this.rollbackOnFailure = rollbackOnFailure;
            return this;
        }

        /**
         * 파라미터 생성.
         *
         * @return CoordinateReleaseParams
         * @throws ValidationException 필수 값이 없거나 형식이 잘못된 경우 (모든 오류를 함께 보고)
         */
        public CoordinateReleaseParams build() {
            List<String> errors = new ArrayList<>();
            if (releaseName == null || releaseName.isBlank()) {
                errors.add("releaseName is required");
            }
            if (environment == null) {
                errors.add("environment is required (allowed: staging, production)");
            }
            if (services.isEmpty()) {
                errors.add("services must contain at least one service");
            }
            if (services.stream().anyMatch(Objects::isNull)) {
                errors.add("services cannot contain null elements");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException(errors);
            }
            return new CoordinateReleaseParams(this);
        }
    }
}
