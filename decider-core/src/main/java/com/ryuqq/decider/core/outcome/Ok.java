package com.ryuqq.decider.core.outcome;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 불가)
 * @param <T> 성공 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public <U> Outcome<U> map(Function<? super T, ? extends U> f) {
        return new Ok<>(f.apply(value));
    }

    @Override
    public <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> f) {
        return f.apply(value);
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
        return onOk.apply(value);
    }
}
