package com.ryuqq.decider.core.model;

/**
 * 두 값의 곱(product).
 *
 * <p>두 머신을 {@code combine}하면 상태는 양쪽 머신의 상태를 나란히 보관하는
 * Pair가 됩니다. 불변 값이며, 변경은 항상 새 인스턴스를 반환합니다.</p>
 *
 * @param first 첫 번째 값 (null 허용)
 * @param second 두 번째 값 (null 허용)
 * @param <A> 첫 번째 값 타입
 * @param <B> 두 번째 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record Pair<A, B>(A first, B second) {

    /**
     * Pair 생성.
     *
     * @param first 첫 번째 값
     * @param second 두 번째 값
     * @param <A> 첫 번째 값 타입
     * @param <B> 두 번째 값 타입
     * @return Pair 인스턴스
     */
    public static <A, B> Pair<A, B> of(A first, B second) {
        return new Pair<>(first, second);
    }

    /**
     * 첫 번째 값만 교체한 새 Pair 생성.
     *
     * @param newFirst 새로운 첫 번째 값
     * @return 새 Pair 인스턴스
     */
    public Pair<A, B> withFirst(A newFirst) {
        return new Pair<>(newFirst, second);
    }

    /**
     * 두 번째 값만 교체한 새 Pair 생성.
     *
     * @param newSecond 새로운 두 번째 값
     * @return 새 Pair 인스턴스
     */
    public Pair<A, B> withSecond(B newSecond) {
        return new Pair<>(first, newSecond);
    }
}
