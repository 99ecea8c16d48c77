package com.ryuqq.decider.core.outcome;

import java.util.function.Function;

/**
 * 엔진 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 모든 단계가 성공하여 값을 반환함</li>
 *   <li>{@link Fail}: 어느 한 단계가 실패함 ({@link Failure}로 원인 구분)</li>
 * </ul>
 *
 * <p>엔진은 예상된 실패 상황에서 예외를 던지지 않고 Fail을 반환합니다.
 * 호출자는 {@link #fold(Function, Function)}로 두 경우를 모두 처리하거나,
 * 예외 기반 흐름이 필요하면 {@link #getOrThrow()}를 사용합니다.</p>
 *
 * <p><strong>처리 예시:</strong></p>
 * <pre>
 * String result = outcome.fold(
 *     events -&gt; "Saved " + events.size() + " events",
 *     failure -&gt; "Failed: " + failure.kind()
 * );
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 성공 값 타입
     * @return Ok 인스턴스
     */
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param failure 실패 원인
     * @param <T> 성공 값 타입
     * @return Fail 인스턴스
     */
    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값 변환 (실패는 그대로 전달).
     *
     * @param f 변환 함수
     * @param <U> 변환된 값 타입
     * @return 변환된 Outcome
     */
    <U> Outcome<U> map(Function<? super T, ? extends U> f);

    /**
     * 성공 값으로 다음 단계 실행 (실패는 그대로 전달).
     *
     * @param f 다음 단계 함수
     * @param <U> 다음 단계 값 타입
     * @return 다음 단계의 Outcome
     */
    <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> f);

    /**
     * 두 경우를 모두 처리하여 단일 값으로 변환.
     *
     * @param onOk 성공 처리 함수
     * @param onFail 실패 처리 함수
     * @param <R> 결과 타입
     * @return 처리 결과
     */
    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail);

    /**
     * 성공 값 반환, 실패면 예외 발생.
     *
     * @return 성공 값
     * @throws OutcomeException 실패인 경우
     */
    default T getOrThrow() {
        return fold(Function.identity(), failure -> {
            throw new OutcomeException(failure);
        });
    }

    /**
     * 실패 원인 조회.
     *
     * @return 실패 원인 (성공이면 null)
     */
    default Failure failureOrNull() {
        return fold(value -> null, Function.identity());
    }
}
