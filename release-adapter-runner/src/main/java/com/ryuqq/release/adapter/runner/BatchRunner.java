package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.core.exception.DeploymentException;
import com.ryuqq.release.core.graph.Batch;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.model.ServiceStatus;
import com.ryuqq.release.core.spi.DeploymentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 배치 하나를 동시에 배포하고 모든 결과를 수집하는 실행기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runBatch(batch)
 *   ↓
 * 배치 전용 스레드 풀 생성 (min(maxConcurrency, 배치 크기))
 *   ↓
 * 서비스별 deploy 제출
 *   ↓
 * 모든 서비스 결과 대기 (실패가 있어도 나머지를 끝까지 기다림)
 *   - 타임아웃: 작업 취소 후 FAILED
 *   - 예외: FAILED (DeploymentException 메시지 보존)
 *   ↓
 * 스레드 풀 종료 대기 후 배치 순서대로 결과 반환
 * </pre>
 *
 * <p>타임아웃은 서비스가 실제로 실행을 시작한 시점부터 측정합니다.
 * 소요 시간도 코디네이터가 직접 측정한 값으로 덮어씁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final DeploymentExecutor executor;
    private final CoordinatorConfig config;

    /**
     * 생성자.
     *
     * @param executor 배포 실행자
     * @param config 코디네이터 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchRunner(DeploymentExecutor executor, CoordinatorConfig config) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executor = executor;
        this.config = config;
    }

    /**
     * 배치 실행.
     *
     * @param batch 실행할 배치
     * @param environment 대상 환경
     * @return 배치 내 서비스 순서대로의 결과 (SUCCESS 또는 FAILED)
     */
    public List<ServiceResult> runBatch(Batch batch, Environment environment) {
        int poolSize = Math.min(config.maxConcurrency(), batch.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);

        List<DeployTask> tasks = new ArrayList<>();
        List<Future<ServiceResult>> futures = new ArrayList<>();
        try {
            for (ServiceDeclaration service : batch.services()) {
                DeployTask task = new DeployTask(service, environment, config.timeoutFor(service));
                tasks.add(task);
                futures.add(pool.submit(task));
            }

            List<ServiceResult> results = new ArrayList<>();
            for (int i = 0; i < tasks.size(); i++) {
                results.add(await(tasks.get(i), futures.get(i)));
            }
            return results;
        } finally {
            shutdown(pool);
        }
    }

    /**
     * 이전에 성공한 서비스 롤백.
     *
     * @param service 서비스 선언
     * @param deployed 배포 성공 결과
     * @param environment 대상 환경
     * @param reason 롤백 사유
     * @return ROLLED_BACK 결과, 롤백이 실패하면 FAILED 결과
     */
    public ServiceResult rollback(ServiceDeclaration service, ServiceResult deployed,
                                  Environment environment, String reason) {
        try {
            ServiceResult result = executor.rollback(service, environment, reason);
            if (result != null && result.status() == ServiceStatus.FAILED) {
                return rollbackFailed(deployed, describeMessage(result.message()));
            }
            return deployed.rolledBack(reason);
        } catch (RuntimeException e) {
            log.error("Rollback of {} threw an exception", service.name(), e);
            return rollbackFailed(deployed, describe(e));
        }
    }

    private ServiceResult rollbackFailed(ServiceResult deployed, String detail) {
        return ServiceResult.failed(deployed.service(), deployed.deploymentId(), deployed.version(),
            deployed.durationMs(), "Rollback failed: " + detail);
    }

    private ServiceResult await(DeployTask task, Future<ServiceResult> future) {
        ServiceDeclaration service = task.service;
        try {
            if (task.timeout == null) {
                return future.get();
            }
            task.started.await();
            long remainingNanos = task.timeout.toNanos() - (System.nanoTime() - task.startNanos);
            return future.get(Math.max(remainingNanos, 0), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Deployment of {} timed out after {}ms", service.name(), task.timeout.toMillis());
            return ServiceResult.failed(service.name(), null, service.version(), task.timeout.toMillis(),
                "Deployment timed out after " + task.timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Deployment of {} failed: {}", service.name(), cause.getMessage());
            return ServiceResult.failed(service.name(), null, service.version(), task.elapsedMs(), describe(cause));
        } catch (CancellationException e) {
            return ServiceResult.failed(service.name(), null, service.version(), task.elapsedMs(),
                "Deployment cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for deployment of {}", service.name());
            return ServiceResult.failed(service.name(), null, service.version(), task.elapsedMs(),
                "Deployment interrupted");
        }
    }

    /**
     * 스레드 풀 종료 (리소스 정리).
     *
     * <p>shutdownTimeoutMs 안에 끝나지 않으면 강제 종료합니다.</p>
     */
    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Deployment pool did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof DeploymentException) {
            return cause.getMessage();
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String describeMessage(String message) {
        return message != null ? message : "executor reported failure";
    }

    /**
     * 서비스 한 개의 배포 작업.
     *
     * <p>실행 시작 시각을 기록해 타임아웃과 소요 시간 측정의 기준으로 삼습니다.</p>
     */
    private final class DeployTask implements Callable<ServiceResult> {

        private final ServiceDeclaration service;
        private final Environment environment;
        private final Duration timeout;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;

        private DeployTask(ServiceDeclaration service, Environment environment, Duration timeout) {
            this.service = service;
            this.environment = environment;
            this.timeout = timeout;
        }

        @Override
        public ServiceResult call() {
            startNanos = System.nanoTime();
            started.countDown();

            ServiceResult reported = executor.deploy(service, environment, timeout);
            return normalize(reported, elapsedMs());
        }

        private long elapsedMs() {
            if (started.getCount() > 0) {
                return 0;
            }
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }

        private ServiceResult normalize(ServiceResult reported, long durationMs) {
            if (reported == null) {
                return ServiceResult.failed(service.name(), null, service.version(), durationMs,
                    "Executor returned no result");
            }
            String version = reported.version() != null ? reported.version() : service.version();
            if (reported.status() == ServiceStatus.SUCCESS) {
                return ServiceResult.success(service.name(), reported.deploymentId(), version, durationMs,
                    reported.healthStatus());
            }
            return ServiceResult.failed(service.name(), reported.deploymentId(), version, durationMs,
                describeMessage(reported.message()));
        }
    }
}
