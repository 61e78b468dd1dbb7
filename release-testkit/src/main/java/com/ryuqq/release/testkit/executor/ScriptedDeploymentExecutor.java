package com.ryuqq.release.testkit.executor;

import com.ryuqq.release.core.exception.DeploymentException;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.spi.DeploymentExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동작을 미리 지정할 수 있는 테스트용 DeploymentExecutor.
 *
 * <p>기본 동작은 즉시 HEALTHY 성공입니다. 서비스별로 실패, 예외, 지연, 헬스,
 * 롤백 실패를 지정할 수 있으며 모든 호출을 순서대로 기록합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedDeploymentExecutor executor = new ScriptedDeploymentExecutor()
 *     .failDeploy("api", "readiness probe failed")
 *     .delay("db", Duration.ofMillis(200))
 *     .reportHealth("cache", HealthStatus.DEGRADED);
 *
 * // ... coordinateRelease ...
 *
 * assertThat(executor.deployCount()).isEqualTo(3);
 * assertThat(executor.rolledBackServices()).containsExactly("cache", "db");
 * </pre>
 *
 * <p>thread-safe하며, 같은 배치의 동시 호출 수 최대값을 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedDeploymentExecutor implements DeploymentExecutor {

    private final Map<String, String> deployFailures = new ConcurrentHashMap<>();
    private final Set<String> deployExceptions = ConcurrentHashMap.newKeySet();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final Map<String, HealthStatus> healths = new ConcurrentHashMap<>();
    private final Map<String, String> rollbackFailures = new ConcurrentHashMap<>();

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<String> deployed = new CopyOnWriteArrayList<>();
    private final List<String> rolledBack = new CopyOnWriteArrayList<>();
    private final Map<String, Map<String, Object>> receivedConfigs = new ConcurrentHashMap<>();
    private final Map<String, Duration> receivedTimeouts = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();

    // ========== 스크립트 ==========

    /**
     * 배포가 FAILED 결과를 보고하도록 지정.
     */
    public ScriptedDeploymentExecutor failDeploy(String service, String message) {
        deployFailures.put(service, message);
        return this;
    }

    /**
     * 배포가 DeploymentException을 던지도록 지정.
     */
    public ScriptedDeploymentExecutor throwOnDeploy(String service) {
        deployExceptions.add(service);
        return this;
    }

    /**
     * 배포 완료 전 지연 지정 (인터럽트되면 즉시 중단).
     */
    public ScriptedDeploymentExecutor delay(String service, Duration delay) {
        delays.put(service, delay);
        return this;
    }

    /**
     * 성공 시 보고할 헬스 지정.
     */
    public ScriptedDeploymentExecutor reportHealth(String service, HealthStatus health) {
        healths.put(service, health);
        return this;
    }

    /**
     * 롤백이 실패하도록 지정.
     */
    public ScriptedDeploymentExecutor failRollback(String service, String message) {
        rollbackFailures.put(service, message);
        return this;
    }

    // ========== DeploymentExecutor ==========

    @Override
    public ServiceResult deploy(ServiceDeclaration service, Environment environment, Duration timeout) {
        String name = service.name().getValue();
        calls.add("deploy:" + name);
        deployed.add(name);
        receivedConfigs.put(name, service.config());
        if (timeout != null) {
            receivedTimeouts.put(name, timeout);
        }

        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            Duration delay = delays.get(name);
            if (delay != null) {
                sleep(name, delay);
            }
            if (deployExceptions.contains(name)) {
                throw new DeploymentException(name, "Scripted deployment exception for " + name);
            }
            String deploymentId = "deploy-" + environment.value() + "-" + name + "-" + sequence.incrementAndGet();
            String failure = deployFailures.get(name);
            if (failure != null) {
                return ServiceResult.failed(service.name(), deploymentId, service.version(), 0, failure);
            }
            return ServiceResult.success(service.name(), deploymentId, service.version(), 0,
                healths.getOrDefault(name, HealthStatus.HEALTHY));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public ServiceResult rollback(ServiceDeclaration service, Environment environment, String reason) {
        String name = service.name().getValue();
        calls.add("rollback:" + name);

        String failure = rollbackFailures.get(name);
        if (failure != null) {
            return ServiceResult.failed(service.name(), null, service.version(), 0, failure);
        }
        rolledBack.add(name);
        return ServiceResult.success(service.name(), "rollback-" + name, service.version(), 0, HealthStatus.HEALTHY);
    }

    // ========== 검증용 조회 ==========

    /**
     * 전체 호출 로그 ("deploy:api", "rollback:db" 형식, 호출 순서).
     */
    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    public List<String> deployedServices() {
        return new ArrayList<>(deployed);
    }

    public List<String> rolledBackServices() {
        return new ArrayList<>(rolledBack);
    }

    public int deployCount() {
        return deployed.size();
    }

    public int rollbackCount() {
        return (int) calls.stream().filter(call -> call.startsWith("rollback:")).count();
    }

    /**
     * 동시에 진행 중이던 배포 수의 최대값.
     */
    public int maxConcurrentDeploys() {
        return maxInFlight.get();
    }

    public Map<String, Object> configReceivedBy(String service) {
        return receivedConfigs.get(service);
    }

    public Duration timeoutReceivedBy(String service) {
        return receivedTimeouts.get(service);
    }

    private static void sleep(String service, Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException(service, "Deployment of " + service + " interrupted", e);
        }
    }
}
