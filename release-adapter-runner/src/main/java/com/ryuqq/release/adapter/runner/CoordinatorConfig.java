package com.ryuqq.release.adapter.runner;

import com.ryuqq.release.core.model.ServiceDeclaration;

import java.time.Duration;

/**
 * BatchReleaseCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrency: 배치 내 동시 배포 스레드 상한 (기본 8)</li>
 *   <li>defaultServiceTimeoutMs: 서비스 선언에 타임아웃이 없을 때 적용 (기본 0 = 제한 없음)</li>
 *   <li>shutdownTimeoutMs: 배치 종료 후 스레드 풀 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrency 배치 내 동시 실행 상한 (1 이상)
 * @param defaultServiceTimeoutMs 기본 서비스 타임아웃 (밀리초, 0이면 제한 없음)
 * @param shutdownTimeoutMs 스레드 풀 종료 대기 시간 (밀리초, 양수)
 */
public record CoordinatorConfig(
    int maxConcurrency,
    long defaultServiceTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrency=8, defaultServiceTimeoutMs=0, shutdownTimeoutMs=60000ms</p>
     */
    public CoordinatorConfig() {
        this(8, 0, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrency must be positive (current: " + maxConcurrency + ")"
            );
        }
        if (defaultServiceTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultServiceTimeoutMs must be non-negative (current: " + defaultServiceTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * 서비스에 적용할 타임아웃.
     *
     * @param service 서비스 선언
     * @return 선언의 타임아웃, 없으면 기본 타임아웃 (둘 다 없으면 null)
     */
    public Duration timeoutFor(ServiceDeclaration service) {
        if (service.timeout() != null) {
            return service.timeout();
        }
        return defaultServiceTimeoutMs > 0 ? Duration.ofMillis(defaultServiceTimeoutMs) : null;
    }

    /**
     * maxConcurrency만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withMaxConcurrency(int maxConcurrency) {
        return new CoordinatorConfig(maxConcurrency, defaultServiceTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * defaultServiceTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withDefaultServiceTimeoutMs(long defaultServiceTimeoutMs) {
        return new CoordinatorConfig(maxConcurrency, defaultServiceTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new CoordinatorConfig(maxConcurrency, defaultServiceTimeoutMs, shutdownTimeoutMs);
    }
}
