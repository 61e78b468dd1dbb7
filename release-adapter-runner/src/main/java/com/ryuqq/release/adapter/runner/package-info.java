/**
 * Runner Adapter Layer - ReleaseCoordinator 구현체.
 *
 * <p>이 패키지는 ReleaseCoordinator 인터페이스의 구체적인 구현체와 그 구성 요소를 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.adapter.runner.BatchReleaseCoordinator} - 검증, 배치 실행, 롤백, 기록</li>
 *   <li>{@link com.ryuqq.release.adapter.runner.BatchPlanner} - 배포 전략별 배치 계획</li>
 *   <li>{@link com.ryuqq.release.adapter.runner.BatchRunner} - 배치 내 동시 배포와 타임아웃</li>
 *   <li>{@link com.ryuqq.release.adapter.runner.HealthAggregator} - 전체 헬스 판정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BatchReleaseCoordinator)
 *   ↓ implements
 * application (ReleaseCoordinator interface)
 *   ↓ depends on
 * core (graph, model, statemachine)
 *   ↓ depends on
 * core/spi (DeploymentExecutor, ReleaseRegistry, ReleaseNotesGenerator)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.release.adapter.runner;
