package com.ryuqq.decider.core.domain;

import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 함수 묶음으로 구성된 Decider 구현.
 *
 * <p>null Command는 빈 Stream, null Event는 State 유지로 처리합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
record FunctionalDecider<C, S, E>(
    BiFunction<? super C, ? super S, ? extends Stream<? extends E>> decideFn,
    BiFunction<? super S, ? super E, ? extends S> evolveFn,
    S initial,
    Predicate<? super S> terminalFn
) implements Decider<C, S, E> {

    FunctionalDecider {
        if (decideFn == null) {
            throw new IllegalArgumentException("decide cannot be null");
        }
        if (evolveFn == null) {
            throw new IllegalArgumentException("evolve cannot be null");
        }
        if (initial == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        if (terminalFn == null) {
            throw new IllegalArgumentException("isTerminal cannot be null");
        }
    }

    @Override
    public Stream<E> decide(C command, S state) {
        if (command == null) {
            return Stream.empty();
        }
        Stream<? extends E> events = decideFn.apply(command, state);
        return events == null ? Stream.empty() : events.map(e -> e);
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

    @Override
    public boolean isTerminal(S state) {
        return terminalFn.test(state);
    }
}
