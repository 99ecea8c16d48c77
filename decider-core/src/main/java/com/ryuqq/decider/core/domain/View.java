package com.ryuqq.decider.core.domain;

import com.ryuqq.decider.core.model.Either;
import com.ryuqq.decider.core.model.Pair;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Event를 State로 접어 올리는 순수 Projection.
 *
 * <p>View는 Decider에서 decide를 뺀 형태로, Event를 받아 조회용 State를 계산합니다.
 * Materialized View는 계산된 State를 저장하고, Ephemeral View는 질의 시점에만 계산합니다.</p>
 *
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface View<S, E> {

    /**
     * State에 Event 적용.
     *
     * @param state 현재 State
     * @param event 적용할 Event
     * @return 다음 State
     */
    S evolve(S state, E event);

    /**
     * 초기 State.
     *
     * @return 초기 State
     */
    S initialState();

    /**
     * Event 시퀀스를 왼쪽부터 차례로 evolve.
     *
     * @param state 시작 State
     * @param events 적용할 Event들
     * @return 모든 Event가 적용된 State
     */
    default S fold(S state, Iterable<? extends E> events) {
        S current = state;
        for (E event : events) {
            current = evolve(current, event);
        }
        return current;
    }

    /**
     * Event 타입 변환 (contravariant).
     *
     * @param f 새 Event를 기존 Event로 변환하는 함수
     * @param <E2> 새 Event 타입
     * @return 변환된 View
     */
    default <E2> View<S, E2> mapLeftOnEvent(Function<? super E2, ? extends E> f) {
        Objects.requireNonNull(f, "f cannot be null");
        View<S, E> self = this;
        return new FunctionalView<S, E2>((s, e2) -> self.evolve(s, f.apply(e2)), self.initialState());
    }

    /**
     * State 타입 변환.
     *
     * @param fl 새 State를 기존 State로 변환하는 함수
     * @param fr 기존 State를 새 State로 변환하는 함수
     * @param <S2> 새 State 타입
     * @return 변환된 View
     */
    default <S2> View<S2, E> dimapOnState(Function<? super S2, ? extends S> fl,
                                         Function<? super S, ? extends S2> fr) {
        Objects.requireNonNull(fl, "fl cannot be null");
        Objects.requireNonNull(fr, "fr cannot be null");
        View<S, E> self = this;
        return new FunctionalView<S2, E>(
            (s2, e) -> fr.apply(self.evolve(fl.apply(s2), e)),
            fr.apply(self.initialState())
        );
    }

    /**
     * 같은 Event 타입을 다루는 두 View의 State 곱.
     *
     * @param other 오른쪽 View
     * @param <S2> 오른쪽 State 타입
     * @return State가 Pair인 View
     */
    default <S2> View<Pair<S, S2>, E> productOnState(View<S2, E> other) {
        Objects.requireNonNull(other, "other cannot be null");
        View<S, E> self = this;
        return new FunctionalView<Pair<S, S2>, E>(
            (s, e) -> Pair.of(self.evolve(s.first(), e), other.evolve(s.second(), e)),
            Pair.of(self.initialState(), other.initialState())
        );
    }

    /**
     * 서로 독립적인 두 View를 하나로 결합.
     *
     * <p>Left Event는 이 View의 State만, Right Event는 other의 State만 변경합니다.</p>
     *
     * @param other 오른쪽 View
     * @param <S2> 오른쪽 State 타입
     * @param <E2> 오른쪽 Event 타입
     * @return 결합된 View
     */
    default <S2, E2> View<Pair<S, S2>, Either<E, E2>> combine(View<S2, E2> other) {
        Objects.requireNonNull(other, "other cannot be null");
        View<S, E> self = this;
        return new FunctionalView<Pair<S, S2>, Either<E, E2>>(
            (s, e) -> e.fold(
                left -> s.withFirst(self.evolve(s.first(), left)),
                right -> s.withSecond(other.evolve(s.second(), right))
            ),
            Pair.of(self.initialState(), other.initialState())
        );
    }

    /**
     * 함수로 View 생성.
     *
     * @param evolve evolve 함수
     * @param initialState 초기 State
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return View 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <S, E> View<S, E> of(BiFunction<? super S, ? super E, ? extends S> evolve, S initialState) {
        return new FunctionalView<>(evolve, initialState);
    }

    /**
     * State를 바꾸지 않는 View. {@link #combine(View)}의 항등원입니다.
     *
     * @param initialState 초기 State
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 빈 View
     */
    static <S, E> View<S, E> empty(S initialState) {
        return new FunctionalView<S, E>((s, e) -> s, initialState);
    }

    /**
     * Builder 생성.
     *
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 새 Builder
     */
    static <S, E> Builder<S, E> builder() {
        return new Builder<>();
    }

    /**
     * View Builder.
     *
     * @param <S> State 타입
     * @param <E> Event 타입
     */
    final class Builder<S, E> {

        private BiFunction<? super S, ? super E, ? extends S> evolve;
        private S initialState;

        private Builder() {
        }

        public Builder<S, E> evolve(BiFunction<? super S, ? super E, ? extends S> evolve) {
            this.evolve = evolve;
            return this;
        }

        public Builder<S, E> initialState(S initialState) {
            this.initialState = initialState;
            return this;
        }

        /**
         * View 생성.
         *
         * @return View 인스턴스
         * @throws IllegalStateException evolve 또는 initialState가 설정되지 않은 경우
         */
        public View<S, E> build() {
            if (evolve == null) {
                throw new IllegalStateException("evolve must be set");
            }
            if (initialState == null) {
                throw new IllegalStateException("initialState must be set");
            }
            return new FunctionalView<>(evolve, initialState);
        }
    }
}
