package com.ryuqq.decider.core.outcome;

/**
 * 저장 실패의 세부 사유.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public enum StoreFailureReason {

    /** 저장소가 쓰기를 거부함 (I/O 오류 등). */
    REJECTED,

    /** 기대 Version이 최신이 아님. 다시 조회하고 다시 decide하면 성공할 수 있음. */
    VERSION_CONFLICT,

    /** 이미 처리되었거나 순서가 맞지 않는 Sequence. */
    DUPLICATE_SEQUENCE
}
