package com.ryuqq.decider.testkit.specification;

import com.ryuqq.decider.core.domain.View;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Given/then specification for views.
 *
 * <pre>
 * ViewSpecification.forView(Numbers.evenNumberView())
 *     .given(new EvenNumberAdded(2), new EvenNumberAdded(4))
 *     .thenState(new EvenNumberState(6));
 * </pre>
 *
 * @param <S> view state type
 * @param <E> event type
 * @author Decider Team
 * @since 1.0.0
 */
public final class ViewSpecification<S, E> {

    private final View<S, E> view;

    private ViewSpecification(View<S, E> view) {
        this.view = view;
    }

    public static <S, E> ViewSpecification<S, E> forView(View<S, E> view) {
        if (view == null) {
            throw new IllegalArgumentException("view cannot be null");
        }
        return new ViewSpecification<>(view);
    }

    @SafeVarargs
    public final Then given(E... events) {
        return given(Arrays.asList(events));
    }

    public Then given(List<E> events) {
        return new Then(view.fold(view.initialState(), events));
    }

    /**
     * Then step.
     */
    public final class Then {

        private final S state;

        private Then(S state) {
            this.state = state;
        }

        /**
         * Asserts the folded view state.
         *
         * @param expected expected state
         * @return this step
         */
        public Then thenState(S expected) {
            assertThat(state).isEqualTo(expected);
            return this;
        }
    }
}
