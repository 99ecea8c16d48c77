package com.ryuqq.decider.core.domain;

import com.ryuqq.decider.core.model.Either;
import com.ryuqq.decider.core.model.Pair;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Command를 받아 Event를 결정하는 순수 상태 머신.
 *
 * <p>Decider는 세 가지 순수 함수로 정의됩니다:</p>
 * <ul>
 *   <li>{@link #decide(Object, Object)}: (Command, State) → Event 시퀀스</li>
 *   <li>{@link #evolve(Object, Object)}: (State, Event) → 다음 State</li>
 *   <li>{@link #initialState()}: 아무 Event도 적용되지 않은 State</li>
 * </ul>
 *
 * <p>Event Sourcing 방식과 State Stored 방식 모두 같은 Decider를 사용합니다.
 * Event Sourcing은 저장된 Event를 {@link #fold(Object, Iterable)}하여 State를 복원하고,
 * State Stored는 저장된 State에 decide 결과를 바로 적용합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>같은 (Command, State)에 대해 decide는 항상 같은 Event 시퀀스를 반환</li>
 *   <li>evolve는 전역 함수이며 예외 없이 다음 State를 반환</li>
 *   <li>null Command는 Event를 만들지 않고, null Event는 State를 바꾸지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Decider&lt;AddNumber, Integer, NumberAdded&gt; decider = Decider.&lt;AddNumber, Integer, NumberAdded&gt;builder()
 *     .decide((c, s) -&gt; Stream.of(new NumberAdded(c.value())))
 *     .evolve((s, e) -&gt; s + e.value())
 *     .initialState(0)
 *     .build();
 * </pre>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface Decider<C, S, E> {

    /**
     * Command와 현재 State로부터 Event 시퀀스 결정.
     *
     * <p>반환되는 Stream은 유한하며 순서가 의미를 가집니다.</p>
     *
     * @param command 처리할 Command
     * @param state 현재 State
     * @return 결정된 Event Stream
     */
    Stream<E> decide(C command, S state);

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
     * 더 이상 Command를 받지 않는 State인지 확인.
     *
     * <p>엔진은 terminal State에 도달한 Aggregate의 Command를 decide하지 않고
     * TerminalStateReached 실패로 응답합니다.</p>
     *
     * @param state 확인할 State
     * @return terminal 여부 (기본값: false)
     */
    default boolean isTerminal(S state) {
        return false;
    }

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
     * Command 타입 변환 (contravariant).
     *
     * @param f 새 Command를 기존 Command로 변환하는 함수
     * @param <C2> 새 Command 타입
     * @return 변환된 Decider
     */
    default <C2> Decider<C2, S, E> mapLeftOnCommand(Function<? super C2, ? extends C> f) {
        Objects.requireNonNull(f, "f cannot be null");
        Decider<C, S, E> self = this;
        return new FunctionalDecider<C2, S, E>(
            (c2, s) -> self.decide(f.apply(c2), s),
            self::evolve,
            self.initialState(),
            self::isTerminal
        );
    }

    /**
     * Event 타입 변환.
     *
     * @param fl 새 Event를 기존 Event로 변환하는 함수 (evolve 입력)
     * @param fr 기존 Event를 새 Event로 변환하는 함수 (decide 출력)
     * @param <E2> 새 Event 타입
     * @return 변환된 Decider
     */
    default <E2> Decider<C, S, E2> dimapOnEvent(Function<? super E2, ? extends E> fl,
                                               Function<? super E, ? extends E2> fr) {
        Objects.requireNonNull(fl, "fl cannot be null");
        Objects.requireNonNull(fr, "fr cannot be null");
        Decider<C, S, E> self = this;
        return new FunctionalDecider<C, S, E2>(
            (c, s) -> self.decide(c, s).map(fr),
            (s, e2) -> self.evolve(s, fl.apply(e2)),
            self.initialState(),
            self::isTerminal
        );
    }

    /**
     * State 타입 변환.
     *
     * @param fl 새 State를 기존 State로 변환하는 함수
     * @param fr 기존 State를 새 State로 변환하는 함수
     * @param <S2> 새 State 타입
     * @return 변환된 Decider
     */
    default <S2> Decider<C, S2, E> dimapOnState(Function<? super S2, ? extends S> fl,
                                               Function<? super S, ? extends S2> fr) {
        Objects.requireNonNull(fl, "fl cannot be null");
        Objects.requireNonNull(fr, "fr cannot be null");
        Decider<C, S, E> self = this;
        return new FunctionalDecider<C, S2, E>(
            (c, s2) -> self.decide(c, fl.apply(s2)),
            (s2, e) -> fr.apply(self.evolve(fl.apply(s2), e)),
            fr.apply(self.initialState()),
            s2 -> self.isTerminal(fl.apply(s2))
        );
    }

    /**
     * 같은 Command/Event 타입을 다루는 두 Decider의 State 곱.
     *
     * <p>decide는 왼쪽 Event 다음에 오른쪽 Event를 이어 붙이고,
     * evolve는 Event를 양쪽 State 모두에 적용합니다.</p>
     *
     * @param other 오른쪽 Decider
     * @param <S2> 오른쪽 State 타입
     * @return State가 Pair인 Decider
     */
    default <S2> Decider<C, Pair<S, S2>, E> productOnState(Decider<? super C, S2, E> other) {
        Objects.requireNonNull(other, "other cannot be null");
        Decider<C, S, E> self = this;
        return new FunctionalDecider<C, Pair<S, S2>, E>(
            (c, s) -> Stream.concat(self.decide(c, s.first()), other.decide(c, s.second())),
            (s, e) -> Pair.of(self.evolve(s.first(), e), other.evolve(s.second(), e)),
            Pair.of(self.initialState(), other.initialState()),
            s -> self.isTerminal(s.first()) && other.isTerminal(s.second())
        );
    }

    /**
     * 서로 독립적인 두 Decider를 하나로 결합.
     *
     * <p>Left Command는 이 Decider로, Right Command는 other로 라우팅되며
     * 생성된 Event는 같은 쪽 태그를 달고 반환됩니다. State는 양쪽 State를 나란히
     * 보관하며, Event는 자신의 태그에 해당하는 쪽 State만 변경합니다.
     * 결합된 Decider는 양쪽이 모두 terminal일 때만 terminal입니다.</p>
     *
     * @param other 오른쪽 Decider
     * @param <C2> 오른쪽 Command 타입
     * @param <S2> 오른쪽 State 타입
     * @param <E2> 오른쪽 Event 타입
     * @return 결합된 Decider
     */
    default <C2, S2, E2> Decider<Either<C, C2>, Pair<S, S2>, Either<E, E2>> combine(Decider<C2, S2, E2> other) {
        Objects.requireNonNull(other, "other cannot be null");
        Decider<C, S, E> self = this;
        return new FunctionalDecider<Either<C, C2>, Pair<S, S2>, Either<E, E2>>(
            (c, s) -> c.fold(
                left -> self.decide(left, s.first()).<Either<E, E2>>map(Either::left),
                right -> other.decide(right, s.second()).<Either<E, E2>>map(Either::right)
            ),
            (s, e) -> e.fold(
                left -> s.withFirst(self.evolve(s.first(), left)),
                right -> s.withSecond(other.evolve(s.second(), right))
            ),
            Pair.of(self.initialState(), other.initialState()),
            s -> self.isTerminal(s.first()) && other.isTerminal(s.second())
        );
    }

    /**
     * 함수로 Decider 생성.
     *
     * @param decide decide 함수
     * @param evolve evolve 함수
     * @param initialState 초기 State
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return Decider 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <C, S, E> Decider<C, S, E> of(BiFunction<? super C, ? super S, ? extends Stream<? extends E>> decide,
                                         BiFunction<? super S, ? super E, ? extends S> evolve,
                                         S initialState) {
        return new FunctionalDecider<>(decide, evolve, initialState, s -> false);
    }

    /**
     * terminal 판정 함수를 포함하여 Decider 생성.
     *
     * @param decide decide 함수
     * @param evolve evolve 함수
     * @param initialState 초기 State
     * @param isTerminal terminal 판정 함수
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return Decider 인스턴스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    static <C, S, E> Decider<C, S, E> of(BiFunction<? super C, ? super S, ? extends Stream<? extends E>> decide,
                                         BiFunction<? super S, ? super E, ? extends S> evolve,
                                         S initialState,
                                         Predicate<? super S> isTerminal) {
        return new FunctionalDecider<>(decide, evolve, initialState, isTerminal);
    }

    /**
     * 아무 것도 결정하지 않고 State도 바꾸지 않는 Decider.
     *
     * <p>{@link #combine(Decider)}의 항등원입니다.</p>
     *
     * @param initialState 초기 State
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 빈 Decider
     */
    static <C, S, E> Decider<C, S, E> empty(S initialState) {
        return new FunctionalDecider<C, S, E>((c, s) -> Stream.empty(), (s, e) -> s, initialState, s -> false);
    }

    /**
     * Builder 생성.
     *
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 새 Builder
     */
    static <C, S, E> Builder<C, S, E> builder() {
        return new Builder<>();
    }

    /**
     * Decider Builder.
     *
     * <p>decide, evolve, initialState는 필수이며 terminalWhen은 선택입니다.</p>
     *
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     */
    final class Builder<C, S, E> {

        private BiFunction<? super C, ? super S, ? extends Stream<? extends E>> decide;
        private BiFunction<? super S, ? super E, ? extends S> evolve;
        private S initialState;
        private Predicate<? super S> isTerminal = s -> false;

        private Builder() {
        }

        public Builder<C, S, E> decide(BiFunction<? super C, ? super S, ? extends Stream<? extends E>> decide) {
            this.decide = decide;
            return this;
        }

        public Builder<C, S, E> evolve(BiFunction<? super S, ? super E, ? extends S> evolve) {
            this.evolve = evolve;
            return this;
        }

        public Builder<C, S, E> initialState(S initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder<C, S, E> terminalWhen(Predicate<? super S> isTerminal) {
            this.isTerminal = isTerminal;
            return this;
        }

        /**
         * Decider 생성.
         *
         * @return Decider 인스턴스
         * @throws IllegalStateException 필수 항목이 설정되지 않은 경우
         */
        public Decider<C, S, E> build() {
            if (decide == null) {
                throw new IllegalStateException("decide must be set");
            }
            if (evolve == null) {
                throw new IllegalStateException("evolve must be set");
            }
            if (initialState == null) {
                throw new IllegalStateException("initialState must be set");
            }
            if (isTerminal == null) {
                throw new IllegalStateException("terminalWhen cannot be null");
            }
            return new FunctionalDecider<>(decide, evolve, initialState, isTerminal);
        }
    }
}
