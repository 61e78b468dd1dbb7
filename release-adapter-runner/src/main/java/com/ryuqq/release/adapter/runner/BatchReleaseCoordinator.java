package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.application.coordinator.CoordinateReleaseParams;
import com.ryuqq.release.application.coordinator.CoordinateReleaseResult;
import com.ryuqq.release.application.coordinator.ReleaseCoordinator;
import com.ryuqq.release.application.coordinator.ReleaseSummary;
import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.graph.Batch;
import com.ryuqq.release.core.graph.CycleDetector;
import com.ryuqq.release.core.graph.DependencyGraph;
import com.ryuqq.release.core.graph.DependencyGraphBuilder;
import com.ryuqq.release.core.graph.ValidationResult;
import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ReleaseUpdate;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.model.ServiceStatus;
import com.ryuqq.release.core.spi.DeploymentExecutor;
import com.ryuqq.release.core.spi.ReleaseNotesGenerator;
import com.ryuqq.release.core.spi.ReleaseRegistry;
import com.ryuqq.release.core.statemachine.ReleaseState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 배치 기반 ReleaseCoordinator 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * coordinateRelease(params)
 *   ↓
 * 검증 게이트: validateDependencies → buildGraph → detectCycles
 *   (실패 시 ValidationException, 배포 호출 0회, 레지스트리 기록 없음)
 *   ↓
 * BatchPlanner.plan(strategy) → [Batch1, Batch2, ...]
 *   ↓
 * registry.addRelease(IN_PROGRESS)
 *   ↓
 * For each Batch (순차):
 *   1. BatchRunner.runBatch() → 배치 내 동시 배포, 전원 완료 대기
 *   2. registry.updateRelease(진행 결과)
 *   3. 실패가 있으면 중단
 *   ↓
 * 실패 + rollbackOnFailure → 성공한 서비스를 배포 역순으로 롤백
 *   ↓
 * 미시도 서비스 SKIPPED, 헬스 집계, 릴리스 노트 생성
 *   ↓
 * registry.updateRelease(종료 상태) → CoordinateReleaseResult
 * </pre>
 *
 * <p><strong>레지스트리 실패:</strong> 로그만 남기고 계산된 결과는 그대로 반환합니다
 * ({@code recorded=false}).</p>
 *
 * <p><strong>동시성:</strong> 호출마다 배치 전용 스레드 풀을 만들고 정리하므로,
 * 한 인스턴스를 여러 릴리스에서 동시에 사용할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchReleaseCoordinator implements ReleaseCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchReleaseCoordinator.class);

    private final ReleaseRegistry registry;
    private final ReleaseNotesGenerator notesGenerator;
    private final BatchRunner runner;
    private final Clock clock;

    /**
     * 생성자 (릴리스 노트 생성 없음, 기본 설정).
     *
     * @param executor 배포 실행자
     * @param registry 릴리스 레지스트리
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchReleaseCoordinator(DeploymentExecutor executor, ReleaseRegistry registry) {
        this(executor, registry, null, new CoordinatorConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param executor 배포 실행자
     * @param registry 릴리스 레지스트리
     * @param notesGenerator 릴리스 노트 생성기 (null이면 노트 없음)
     * @param config 코디네이터 설정
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public BatchReleaseCoordinator(DeploymentExecutor executor, ReleaseRegistry registry,
                                   ReleaseNotesGenerator notesGenerator, CoordinatorConfig config) {
        this(executor, registry, notesGenerator, config, Clock.systemUTC());
    }

    /**
     * 생성자 (Clock 주입).
     *
     * @param executor 배포 실행자
     * @param registry 릴리스 레지스트리
     * @param notesGenerator 릴리스 노트 생성기 (null이면 노트 없음)
     * @param config 코디네이터 설정
     * @param clock 릴리스 시작 시각 기준
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public BatchReleaseCoordinator(DeploymentExecutor executor, ReleaseRegistry registry,
                                   ReleaseNotesGenerator notesGenerator, CoordinatorConfig config, Clock clock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.notesGenerator = notesGenerator;
        this.runner = new BatchRunner(executor, config);
        this.clock = clock;
    }

    @Override
    public CoordinateReleaseResult coordinateRelease(CoordinateReleaseParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }

        List<ServiceDeclaration> services = params.getServices();
        ReleaseId releaseId = ReleaseId.generate(params.getReleaseName());
        Instant timestamp = clock.instant();
        long startNanos = System.nanoTime();

        log.info("Release {} ({}) requested: {} services, environment={}, strategy={}, rollbackOnFailure={}",
            releaseId.getValue(), params.getReleaseName(), services.size(),
            params.getEnvironment().value(), params.getStrategy().value(), params.isRollbackOnFailure());

        // 1. 검증 게이트
        ValidationResult validation = validate(releaseId, services);
        DependencyGraph graph = DependencyGraphBuilder.buildGraph(services);
        rejectCycles(releaseId, graph);

        // 2. 배치 계획
        List<Batch> batches = BatchPlanner.plan(params.getStrategy(), graph);
        log.info("Release {} planned {} batches: {}", releaseId.getValue(), batches.size(), describe(batches));

        Execution execution = new Execution(releaseId, params, validation.warnings(), timestamp, startNanos);
        execution.start();

        // 3. 배치 순차 실행
        Batch failedBatch = null;
        for (Batch batch : batches) {
            log.info("Release {} batch {}/{} started: {}",
                releaseId.getValue(), batch.id(), batches.size(), batch.serviceNames());

            List<ServiceResult> batchResults = runner.runBatch(batch, params.getEnvironment());
            execution.recordBatch(batchResults);

            long failedCount = batchResults.stream().filter(ServiceResult::isFailed).count();
            log.info("Release {} batch {}/{} finished: {} succeeded, {} failed",
                releaseId.getValue(), batch.id(), batches.size(), batchResults.size() - failedCount, failedCount);

            if (failedCount > 0) {
                failedBatch = batch;
                break;
            }
        }

        // 4. 실패 처리
        if (failedBatch != null && params.isRollbackOnFailure()) {
            rollback(execution, graph, failedBatch);
        }

        return execution.finish(failedBatch != null);
    }

    private ValidationResult validate(ReleaseId releaseId, List<ServiceDeclaration> services) {
        ValidationResult validation = DependencyGraphBuilder.validateDependencies(services);
        if (!validation.valid()) {
            log.warn("Release {} rejected: {} dependency errors {}",
                releaseId.getValue(), validation.errors().size(), validation.errorMessages());
            validation.throwIfInvalid();
        }
        for (String warning : validation.warnings()) {
            log.warn("Release {}: {}", releaseId.getValue(), warning);
        }
        return validation;
    }

    private void rejectCycles(ReleaseId releaseId, DependencyGraph graph) {
        List<List<ServiceName>> cycles = CycleDetector.detectCycles(graph);
        if (cycles.isEmpty()) {
            return;
        }
        List<String> errors = cycles.stream()
            .map(cycle -> "Circular dependency detected: " + CycleDetector.describe(cycle))
            .toList();
        log.warn("Release {} rejected: {}", releaseId.getValue(), errors);
        throw new ValidationException(errors);
    }

    /**
     * 성공한 서비스를 배포 역순으로 하나씩 롤백.
     */
    private void rollback(Execution execution, DependencyGraph graph, Batch failedBatch) {
        List<ServiceName> succeeded = execution.deploymentOrder.stream()
            .filter(name -> execution.results.get(name).isSuccess())
            .collect(Collectors.toCollection(ArrayList::new));
        if (succeeded.isEmpty()) {
            log.info("Release {}: nothing to roll back", execution.releaseId.getValue());
            return;
        }

        List<String> failedServices = failedBatch.serviceNames().stream()
            .filter(name -> execution.results.get(name).isFailed())
            .map(ServiceName::getValue)
            .toList();
        String reason = "Release " + execution.releaseId.getValue() + " failed at batch " + failedBatch.id()
            + " (failed services: " + String.join(", ", failedServices) + ")";

        log.warn("Release {} rolling back {} services in reverse order", execution.releaseId.getValue(), succeeded.size());
        for (int i = succeeded.size() - 1; i >= 0; i--) {
            ServiceName name = succeeded.get(i);
            ServiceResult result = runner.rollback(graph.get(name), execution.results.get(name),
                execution.params.getEnvironment(), reason);
            execution.results.put(name, result);
            log.info("Release {} rollback of {}: {}", execution.releaseId.getValue(), name, result.status().value());
        }
    }

    private static String describe(List<Batch> batches) {
        return batches.stream()
            .map(batch -> batch.serviceNames().toString())
            .collect(Collectors.joining(" -> "));
    }

    /**
     * 릴리스 한 건의 진행 상태.
     *
     * <p>레지스트리와 별개로 기록을 로컬에 유지하므로 레지스트리가 실패해도 결과 계산은 계속됩니다.</p>
     */
    private final class Execution {

        private final ReleaseId releaseId;
        private final CoordinateReleaseParams params;
        private final List<String> warnings;
        private final long startNanos;
        private final Map<ServiceName, ServiceResult> results = new LinkedHashMap<>();
        private final List<ServiceName> deploymentOrder = new ArrayList<>();
        private ReleaseRecord record;
        private boolean added;
        private boolean recorded = true;

        private Execution(ReleaseId releaseId, CoordinateReleaseParams params, List<String> warnings,
                          Instant timestamp, long startNanos) {
            this.releaseId = releaseId;
            this.params = params;
            this.warnings = warnings;
            this.startNanos = startNanos;
            this.record = ReleaseRecord.pending(releaseId, params.getReleaseName(), params.getEnvironment(),
                timestamp, params.getServices().stream().map(ServiceDeclaration::name).toList());
        }

        private void start() {
            record = record.apply(ReleaseUpdate.builder().status(ReleaseState.IN_PROGRESS).build());
            try {
                registry.addRelease(record);
                added = true;
            } catch (RuntimeException e) {
                recorded = false;
                log.error("Failed to register release {} in registry", releaseId.getValue(), e);
            }
        }

        private void recordBatch(List<ServiceResult> batchResults) {
            for (ServiceResult result : batchResults) {
                results.put(result.service(), result);
                deploymentOrder.add(result.service());
                if (result.isFailed()) {
                    log.warn("Release {} service {} failed after {}ms: {}",
                        releaseId.getValue(), result.service(), result.durationMs(), result.message());
                } else {
                    log.info("Release {} service {} deployed in {}ms (health={})",
                        releaseId.getValue(), result.service(), result.durationMs(), result.healthStatus().value());
                }
            }
            update(ReleaseUpdate.builder()
                .deploymentOrder(deploymentOrder)
                .serviceResults(attemptedResultsInInputOrder())
                .durationMs(elapsedMs())
                .build());
        }

        private CoordinateReleaseResult finish(boolean failed) {
            List<ServiceResult> finalResults = new ArrayList<>();
            for (ServiceDeclaration service : params.getServices()) {
                ServiceResult result = results.get(service.name());
                finalResults.add(result != null ? result : ServiceResult.skipped(service.name(), service.version()));
            }

            boolean rolledBack = finalResults.stream().anyMatch(r -> r.status() == ServiceStatus.ROLLED_BACK);
            ReleaseState status = !failed
                ? ReleaseState.SUCCESS
                : rolledBack ? ReleaseState.ROLLED_BACK : ReleaseState.FAILED;
            HealthStatus health = HealthAggregator.aggregate(finalResults);
            long durationMs = elapsedMs();

            ReleaseUpdate.Builder terminal = ReleaseUpdate.builder()
                .status(status)
                .deploymentOrder(deploymentOrder)
                .serviceResults(finalResults)
                .durationMs(durationMs)
                .overallHealth(health);

            String releaseNotes = generateNotes(record.apply(terminal.build()));
            if (releaseNotes != null) {
                terminal.releaseNotesPath(releaseNotes);
            }
            update(terminal.build());

            log.info("Release {} finished: status={}, health={}, duration={}ms, recorded={}",
                releaseId.getValue(), status.value(), health.value(), durationMs, recorded);

            return new CoordinateReleaseResult(
                status == ReleaseState.SUCCESS,
                releaseId,
                params.getEnvironment(),
                record.timestamp(),
                status,
                ReleaseSummary.of(finalResults, durationMs),
                deploymentOrder,
                finalResults,
                health,
                releaseNotes,
                warnings,
                recorded
            );
        }

        private String generateNotes(ReleaseRecord terminalRecord) {
            if (notesGenerator == null) {
                return null;
            }
            try {
                return notesGenerator.generate(terminalRecord);
            } catch (RuntimeException e) {
                log.warn("Release notes generation failed for {}", releaseId.getValue(), e);
                return null;
            }
        }

        private void update(ReleaseUpdate update) {
            record = record.apply(update);
            if (!added) {
                return;
            }
            try {
                registry.updateRelease(releaseId, update);
            } catch (RuntimeException e) {
                recorded = false;
                log.error("Failed to update release {} in registry", releaseId.getValue(), e);
            }
        }

        private List<ServiceResult> attemptedResultsInInputOrder() {
            List<ServiceResult> attempted = new ArrayList<>();
            for (ServiceDeclaration service : params.getServices()) {
                ServiceResult result = results.get(service.name());
                if (result != null) {
                    attempted.add(result);
                }
            }
            return attempted;
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
