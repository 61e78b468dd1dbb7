package com.ryuqq.release.core.model;

import java.util.Collection;

/**
 * 저장된 릴리스 기록으로부터 계산한 통계 (영속화하지 않음).
 *
 * @param total 전체 건수
 * @param successful SUCCESS 건수
 * @param failed FAILED 건수
 * @param rolledBack ROLLED_BACK 건수
 * @param inProgress PENDING/IN_PROGRESS 건수
 * @param successRate 성공률 (0.0 ~ 1.0, 기록이 없으면 0.0)
 * @param averageDurationMs 평균 소요 시간 (기록이 없으면 0.0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReleaseStatistics(
    int total,
    int successful,
    int failed,
    int rolledBack,
    int inProgress,
    double successRate,
    double averageDurationMs
) {

    /**
     * 기록 목록으로부터 통계 계산.
     *
     * @param records 대상 기록
     * @return 계산된 통계
     */
    public static ReleaseStatistics from(Collection<ReleaseRecord> records) {
        int total = records.size();
        int successful = 0;
        int failed = 0;
        int rolledBack = 0;
        int inProgress = 0;
        long durationSum = 0;

        for (ReleaseRecord record : records) {
            durationSum += record.durationMs();
            switch (record.status()) {
                case SUCCESS -> successful++;
                case FAILED -> failed++;
                case ROLLED_BACK -> rolledBack++;
                case PENDING, IN_PROGRESS -> inProgress++;
            }
        }

        double successRate = total == 0 ? 0.0 : (double) successful / total;
        double averageDurationMs = total == 0 ? 0.0 : (double) durationSum / total;
        return new ReleaseStatistics(total, successful, failed, rolledBack, inProgress, successRate, averageDurationMs);
    }

    /**
     * 빈 통계.
     *
     * @return 모든 값이 0인 통계
     */
    public static ReleaseStatistics empty() {
        return new ReleaseStatistics(0, 0, 0, 0, 0, 0.0, 0.0);
    }

    /**
     * 종료 상태 건수.
     *
     * @return SUCCESS + FAILED + ROLLED_BACK
     */
    public int finished() {
        return total - inProgress;
    }
}
