package com.ryuqq.release.core.statemachine;

/**
 * 릴리스의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS (검증 통과, 실행 시작)</li>
 *   <li>IN_PROGRESS → SUCCESS (모든 배치 성공)</li>
 *   <li>IN_PROGRESS → FAILED (실패, 롤백 없음)</li>
 *   <li>IN_PROGRESS → ROLLED_BACK (실패 후 자동 롤백)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (검증 통과)
 * IN_PROGRESS
 *    │
 *    ├─► SUCCESS
 *    ├─► FAILED
 *    └─► ROLLED_BACK
 *
 * 금지된 전이:
 * - SUCCESS / FAILED / ROLLED_BACK → * ❌
 * - IN_PROGRESS → PENDING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReleaseState {

    /**
     * 생성됨 (아직 실행 시작 안 됨).
     */
    PENDING("pending"),

    /**
     * 배치 실행 중.
     */
    IN_PROGRESS("in-progress"),

    /**
     * 성공.
     */
    SUCCESS("success"),

    /**
     * 실패 (롤백 없음).
     */
    FAILED("failed"),

    /**
     * 실패 후 롤백됨.
     */
    ROLLED_BACK("rolled-back");

    private final String value;

    ReleaseState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(SUCCESS, FAILED, ROLLED_BACK)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return 종료 상태인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == ROLLED_BACK;
    }

    /**
     * 외부 표현 값으로부터 상태 조회.
     *
     * @param value 상태 값 (예: "in-progress")
     * @return ReleaseState
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ReleaseState fromValue(String value) {
        for (ReleaseState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown release state: " + value);
    }
}
