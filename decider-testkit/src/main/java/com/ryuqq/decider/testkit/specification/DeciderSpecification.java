package com.ryuqq.decider.testkit.specification;

import com.ryuqq.decider.core.domain.Decider;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Given/when/then specification for deciders.
 *
 * <p>Event-sourced form: the given events are folded from the initial state.</p>
 * <pre>
 * DeciderSpecification.forDecider(Numbers.evenNumberDecider())
 *     .given(new EvenNumberAdded(2))
 *     .when(new AddEvenNumber(4))
 *     .thenEvents(new EvenNumberAdded(4))
 *     .thenState(new EvenNumberState(6));
 * </pre>
 *
 * <p>State-stored form: start from an explicit state.</p>
 * <pre>
 * DeciderSpecification.forDecider(decider)
 *     .givenState(new EvenNumberState(2))
 *     .when(new AddEvenNumber(4))
 *     .thenState(new EvenNumberState(6));
 * </pre>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 * @author Decider Team
 * @since 1.0.0
 */
public final class DeciderSpecification<C, S, E> {

    private final Decider<C, S, E> decider;

    private DeciderSpecification(Decider<C, S, E> decider) {
        this.decider = decider;
    }

    /**
     * Starts a specification for the given decider.
     *
     * @param decider the decider under test
     * @param <C> command type
     * @param <S> state type
     * @param <E> event type
     * @return the specification
     */
    public static <C, S, E> DeciderSpecification<C, S, E> forDecider(Decider<C, S, E> decider) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        return new DeciderSpecification<>(decider);
    }

    /**
     * Given past events, folded from the initial state.
     *
     * @param events past events, oldest first
     * @return the when step
     */
    @SafeVarargs
    public final When given(E... events) {
        return given(Arrays.asList(events));
    }

    /**
     * Given past events, folded from the initial state.
     *
     * @param events past events, oldest first
     * @return the when step
     */
    public When given(List<E> events) {
        return new When(decider.fold(decider.initialState(), events));
    }

    /**
     * Given a stored state.
     *
     * @param state the current state
     * @return the when step
     */
    public When givenState(S state) {
        return new When(state);
    }

    /**
     * When step.
     */
    public final class When {

        private final S state;

        private When(S state) {
            this.state = state;
        }

        /**
         * Decides the command against the given state.
         *
         * @param command the command
         * @return the then step
         */
        public Then when(C command) {
            try {
                List<E> events = decider.decide(command, state).collect(Collectors.toList());
                return new Then(state, events, null);
            } catch (RuntimeException e) {
                return new Then(state, List.of(), e);
            }
        }
    }

    /**
     * Then step. Assertions can be chained.
     */
    public final class Then {

        private final S state;
        private final List<E> events;
        private final RuntimeException failure;

        private Then(S state, List<E> events, RuntimeException failure) {
            this.state = state;
            this.events = events;
            this.failure = failure;
        }

        /**
         * Asserts the decided events, in order.
         *
         * @param expected expected events
         * @return this step
         */
        @SafeVarargs
        public final Then thenEvents(E... expected) {
            assertThat(failure).as("decide failure").isNull();
            assertThat(events).containsExactly(expected);
            return this;
        }

        /**
         * Asserts that nothing was decided.
         *
         * @return this step
         */
        public Then thenNoEvents() {
            assertThat(failure).as("decide failure").isNull();
            assertThat(events).isEmpty();
            return this;
        }

        /**
         * Asserts the state after evolving the decided events.
         *
         * @param expected expected state
         * @return this step
         */
        public Then thenState(S expected) {
            assertThat(failure).as("decide failure").isNull();
            assertThat(decider.fold(state, events)).isEqualTo(expected);
            return this;
        }

        /**
         * Asserts that decide threw.
         *
         * @param type expected exception type
         * @return this step
         */
        public Then thenThrows(Class<? extends RuntimeException> type) {
            assertThat(failure).isInstanceOf(type);
            return this;
        }
    }
}
