/**
 * Release Application Layer - 릴리스 조정 API.
 *
 * <p>클라이언트가 릴리스를 요청하고 결과를 받는 포트입니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.application.coordinator.ReleaseCoordinator} - 릴리스 조정자</li>
 *   <li>{@link com.ryuqq.release.application.coordinator.CoordinateReleaseParams} - 요청 파라미터</li>
 *   <li>{@link com.ryuqq.release.application.coordinator.CoordinateReleaseResult} - 릴리스 결과</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 release-adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.release.application.coordinator;
