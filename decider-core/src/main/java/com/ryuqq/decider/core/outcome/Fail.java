package com.ryuqq.decider.core.outcome;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>어느 단계에서 무엇 때문에 실패했는지는 {@link Failure}가 표현합니다.
 * 실패 이후의 단계는 실행되지 않습니다.</p>
 *
 * @param failure 실패 원인 (null 불가)
 * @param <T> 성공 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record Fail<T>(Failure failure) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public Fail {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }

    /**
     * 실패 종류 조회.
     *
     * @return 실패 종류
     */
    public FailureKind kind() {
        return failure.kind();
    }

    @Override
    public <U> Outcome<U> map(Function<? super T, ? extends U> f) {
        return new Fail<>(failure);
    }

    @Override
    public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> f) {
        return new Fail<>(failure);
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
        return onFail.apply(failure);
    }
}
