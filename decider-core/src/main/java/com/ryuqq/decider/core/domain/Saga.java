package com.ryuqq.decider.core.domain;

import com.ryuqq.decider.core.model.Either;

import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Action Result(보통 Event)에 반응하여 후속 Action(보통 Command)을 만드는 순수 함수.
 *
 * <p>Saga는 Aggregate 사이의 흐름을 연결합니다. Orchestrating Aggregate는 생성된 각 Event를
 * Saga에 전달하고, 반환된 Command를 다시 같은 Aggregate에 제출합니다.</p>
 *
 * <p>{@link #empty()}는 {@link #combine(Saga)}와 {@link #merge(Saga)} 모두의 항등원입니다.</p>
 *
 * @param <AR> Action Result 타입
 * @param <A> Action 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Saga<AR, A> {

    /**
     * Action Result에 반응.
     *
     * @param actionResult 처리할 Action Result
     * @return 후속 Action Stream (없으면 빈 Stream)
     */
    Stream<A> react(AR actionResult);

    /**
     * Action Result 타입 변환 (contravariant).
     *
     * @param f 새 Action Result를 기존 Action Result로 변환하는 함수
     * @param <AR2> 새 Action Result 타입
     * @return 변환된 Saga
     */
    default <AR2> Saga<AR2, A> mapLeftOnActionResult(Function<? super AR2, ? extends AR> f) {
        Objects.requireNonNull(f, "f cannot be null");
        Saga<AR, A> self = this;
        return of(ar2 -> self.react(f.apply(ar2)));
    }

    /**
     * Action 타입 변환.
     *
     * @param f 기존 Action을 새 Action으로 변환하는 함수
     * @param <A2> 새 Action 타입
     * @return 변환된 Saga
     */
    default <A2> Saga<AR, A2> mapOnAction(Function<? super A, ? extends A2> f) {
        Objects.requireNonNull(f, "f cannot be null");
        Saga<AR, A> self = this;
        return of(ar -> self.react(ar).<A2>map(f));
    }

    /**
     * 서로 독립적인 두 Saga를 하나로 결합.
     *
     * <p>Left Action Result는 이 Saga로, Right는 other로 라우팅되고
     * 생성된 Action은 같은 쪽 태그를 답니다.</p>
     *
     * @param other 오른쪽 Saga
     * @param <AR2> 오른쪽 Action Result 타입
     * @param <A2> 오른쪽 Action 타입
     * @return 결합된 Saga
     */
    default <AR2, A2> Saga<Either<AR, AR2>, Either<A, A2>> combine(Saga<AR2, A2> other) {
        Objects.requireNonNull(other, "other cannot be null");
        Saga<AR, A> self = this;
        return of(ar -> ar.fold(
            left -> self.react(left).<Either<A, A2>>map(Either::left),
            right -> other.react(right).<Either<A, A2>>map(Either::right)
        ));
    }

    /**
     * 같은 타입의 두 Saga를 병합. 이 Saga의 Action 다음에 other의 Action이 이어집니다.
     *
     * @param other 병합할 Saga
     * @return 병합된 Saga
     */
    default Saga<AR, A> merge(Saga<AR, A> other) {
        Objects.requireNonNull(other, "other cannot be null");
        Saga<AR, A> self = this;
        return of(ar -> Stream.concat(self.react(ar), other.react(ar)));
    }

    /**
     * 함수로 Saga 생성. null Action Result와 null 반환은 빈 Stream으로 처리합니다.
     *
     * @param react react 함수
     * @param <AR> Action Result 타입
     * @param <A> Action 타입
     * @return Saga 인스턴스
     * @throws IllegalArgumentException react가 null인 경우
     */
    static <AR, A> Saga<AR, A> of(Function<? super AR, ? extends Stream<? extends A>> react) {
        if (react == null) {
            throw new IllegalArgumentException("react cannot be null");
        }
        return actionResult -> {
            if (actionResult == null) {
                return Stream.empty();
            }
            Stream<? extends A> actions = react.apply(actionResult);
            return actions == null ? Stream.empty() : actions.map(a -> a);
        };
    }

    /**
     * 아무 Action도 만들지 않는 Saga.
     *
     * @param <AR> Action Result 타입
     * @param <A> Action 타입
     * @return 빈 Saga
     */
    static <AR, A> Saga<AR, A> empty() {
        return actionResult -> Stream.empty();
    }
}
