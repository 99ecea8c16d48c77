package com.ryuqq.decider.core.domain;

import java.util.function.BiFunction;

/**
 * 함수로 구성된 View 구현. null Event는 State를 바꾸지 않습니다.
 *
 * @author Decider Team
 * @since 1.0.0
 */
record FunctionalView<S, E>(
    BiFunction<? super S, ? super E, ? extends S> evolveFn,
    S initial
) implements View<S, E> {

    FunctionalView {
        if (evolveFn == null) {
            throw new IllegalArgumentException("evolve cannot be null");
        }
        if (initial == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
    }

    @Override
    public S evolve(S state, E event) {
        if (event == null) {
            return state;
        }
        return evolveFn.apply(state, event);
    }

    @Override
    public S initialState() {
        return initial;
    }
}
