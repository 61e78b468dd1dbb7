package com.ryuqq.release.core.statemachine;

/**
 * 릴리스 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS</li>
 *   <li>IN_PROGRESS → SUCCESS | FAILED | ROLLED_BACK</li>
 * </ul>
 *
 * <p>같은 상태로의 전이(IN_PROGRESS → IN_PROGRESS)는 배치 단위 중간 갱신을 위해 허용됩니다.
 * 종료 상태에서는 자기 자신으로의 전이도 허용되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ReleaseState from, ReleaseState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == ReleaseState.IN_PROGRESS;
            case IN_PROGRESS -> to == ReleaseState.IN_PROGRESS || to.isTerminal();
            case SUCCESS, FAILED, ROLLED_BACK -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ReleaseState transition(ReleaseState current, ReleaseState next) {
        validate(current, next);
        return next;
    }
}
