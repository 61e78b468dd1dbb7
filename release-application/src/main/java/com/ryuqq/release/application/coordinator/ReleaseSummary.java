package com.ryuqq.release.application.coordinator;

import com.ryuqq.release.core.model.ServiceResult;

import java.util.Collection;

/**
 * 서비스 결과 집계.
 *
 * @param totalServices 요청된 서비스 수
 * @param deployed 성공 상태로 끝난 서비스 수
 * @param failed 실패 상태로 끝난 서비스 수
 * @param rolledBack 롤백된 서비스 수
 * @param skipped 시도되지 않은 서비스 수
 * @param durationMs 릴리스 전체 소요 시간 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReleaseSummary(
    int totalServices,
    int deployed,
    int failed,
    int rolledBack,
    int skipped,
    long durationMs
) {

    public ReleaseSummary {
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative (current: " + durationMs + ")");
        }
    }

    /**
     * 서비스 결과로부터 집계.
     *
     * @param results 서비스별 최종 결과
     * @param durationMs 전체 소요 시간
     * @return ReleaseSummary
     */
    public static ReleaseSummary of(Collection<ServiceResult> results, long durationMs) {
        int deployed = 0;
        int failed = 0;
        int rolledBack = 0;
        int skipped = 0;
        for (ServiceResult result : results) {
            switch (result.status()) {
                case SUCCESS -> deployed++;
                case FAILED -> failed++;
                case ROLLED_BACK -> rolledBack++;
                case SKIPPED -> skipped++;
            }
        }
        return new ReleaseSummary(results.size(), deployed, failed, rolledBack, skipped, durationMs);
    }
}
