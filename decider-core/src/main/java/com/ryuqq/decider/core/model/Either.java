package com.ryuqq.decider.core.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * 두 가지 경우 중 하나를 명시적으로 표현하는 Tagged Union.
 *
 * <p>두 머신을 {@code combine}할 때 Command, Event, Action Result는 어느 쪽 머신에
 * 속하는지를 Either의 태그({@link Left}, {@link Right})로 구분합니다.
 * null을 "해당 variant 없음"의 의미로 사용하지 않습니다.</p>
 *
 * <p><strong>Exhaustive 처리:</strong></p>
 * <pre>
 * String description = either.fold(
 *     left -&gt; "left: " + left,
 *     right -&gt; "right: " + right
 * );
 * </pre>
 *
 * @param <L> Left 값 타입
 * @param <R> Right 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {

    /**
     * Left 값 생성.
     *
     * @param value Left 값 (null 불가)
     * @param <L> Left 값 타입
     * @param <R> Right 값 타입
     * @return Left 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    /**
     * Right 값 생성.
     *
     * @param value Right 값 (null 불가)
     * @param <L> Left 값 타입
     * @param <R> Right 값 타입
     * @return Right 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    /**
     * 두 경우를 모두 처리하여 단일 값으로 변환.
     *
     * @param onLeft Left 처리 함수
     * @param onRight Right 처리 함수
     * @param <T> 결과 타입
     * @return 처리 결과
     */
    <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

    /**
     * Right 값 변환 (Left는 그대로 유지).
     *
     * @param f Right 변환 함수
     * @param <R2> 변환된 Right 타입
     * @return 변환된 Either
     */
    default <R2> Either<L, R2> map(Function<? super R, ? extends R2> f) {
        return fold(Either::left, r -> Either.right(f.apply(r)));
    }

    /**
     * Left 값 변환 (Right는 그대로 유지).
     *
     * @param f Left 변환 함수
     * @param <L2> 변환된 Left 타입
     * @return 변환된 Either
     */
    default <L2> Either<L2, R> mapLeft(Function<? super L, ? extends L2> f) {
        return fold(l -> Either.left(f.apply(l)), Either::right);
    }

    /**
     * Left와 Right를 뒤바꿈.
     *
     * @return 태그가 반전된 Either
     */
    default Either<R, L> swap() {
        return fold(Either::right, Either::left);
    }

    default boolean isLeft() {
        return this instanceof Left;
    }

    default boolean isRight() {
        return this instanceof Right;
    }

    /**
     * Left 값 조회.
     *
     * @return Left인 경우 값, 아니면 empty
     */
    default Optional<L> leftValue() {
        return fold(Optional::of, r -> Optional.empty());
    }

    /**
     * Right 값 조회.
     *
     * @return Right인 경우 값, 아니면 empty
     */
    default Optional<R> rightValue() {
        return fold(l -> Optional.empty(), Optional::of);
    }

    /**
     * Left variant.
     *
     * @param value Left 값
     */
    record Left<L, R>(L value) implements Either<L, R> {

        public Left {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onLeft.apply(value);
        }
    }

    /**
     * Right variant.
     *
     * @param value Right 값
     */
    record Right<L, R>(R value) implements Either<L, R> {

        public Right {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onRight.apply(value);
        }
    }
}
