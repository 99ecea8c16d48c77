package com.ryuqq.decider.core.outcome;

/**
 * {@link Outcome#getOrThrow()}가 실패 결과에서 던지는 예외.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class OutcomeException extends RuntimeException {

    private final transient Failure failure;

    /**
     * OutcomeException 생성.
     *
     * @param failure 실패 원인
     */
    public OutcomeException(Failure failure) {
        super(failure == null ? "unknown failure" : failure.describe(), failure == null ? null : failure.cause());
        this.failure = failure;
    }

    /**
     * 실패 원인 조회.
     *
     * @return 실패 원인
     */
    public Failure failure() {
        return failure;
    }
}
