package com.ryuqq.release.application.coordinator;

/**
 * 릴리스 조정자.
 *
 * <p>여러 서비스의 배포를 의존성 순서에 맞춰 배치로 나누어 실행하고,
 * 실패 시 롤백하며, 결과를 레지스트리에 기록합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CoordinateReleaseParams params = CoordinateReleaseParams.builder()
 *     .releaseName("2026-q1")
 *     .environment(Environment.STAGING)
 *     .services(List.of(
 *         ServiceDeclaration.of("db", "1.4.0"),
 *         ServiceDeclaration.of("api", "2.1.0", "db")))
 *     .rollbackOnFailure(true)
 *     .build();
 *
 * CoordinateReleaseResult result = coordinator.coordinateRelease(params);
 * if (!result.success()) {
 *     // result.status() == ROLLED_BACK or FAILED
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ReleaseCoordinator {

    /**
     * 릴리스 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>의존성 검증, 그래프 생성, 순환 탐지 (실패 시 아무것도 배포하지 않음)</li>
     *   <li>전략에 따라 배치 계획 수립</li>
     *   <li>배치를 순서대로 실행 (배치 내부는 동시 실행)</li>
     *   <li>실패 시 중단 또는 롤백</li>
     *   <li>헬스 집계, 릴리스 노트 생성, 레지스트리 기록</li>
     * </ol>
     *
     * <p>개별 서비스의 배포 실패는 예외로 전파되지 않고 결과에 담깁니다.</p>
     *
     * @param params 릴리스 요청
     * @return 릴리스 결과
     * @throws IllegalArgumentException params가 null인 경우
     * @throws com.ryuqq.release.core.exception.ValidationException 의존성 오류나 순환이 있는 경우
     */
    CoordinateReleaseResult coordinateRelease(CoordinateReleaseParams params);
}
