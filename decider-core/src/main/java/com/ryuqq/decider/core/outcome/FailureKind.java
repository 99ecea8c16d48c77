package com.ryuqq.decider.core.outcome;

/**
 * 실패가 발생한 단계.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public enum FailureKind {

    /** 저장소에서 Event 또는 State 조회 실패. */
    FETCH_FAILED,

    /** decide, evolve, react 계산 실패. */
    CALCULATION_FAILED,

    /** 저장소 저장 또는 Action 발행 거부. */
    STORE_FAILED,

    /** terminal State에 Command가 도착함. */
    TERMINAL_STATE_REACHED,

    /** 입력 스트림 자체를 읽지 못함. */
    PUBLISHING_FAILED
}
