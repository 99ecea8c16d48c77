package com.ryuqq.decider.application.support;

import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.outcome.StoreFailureReason;
import com.ryuqq.decider.core.spi.DuplicateSequenceException;
import com.ryuqq.decider.core.spi.VersionConflictException;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 엔진 파이프라인의 단계 실행기.
 *
 * <p>각 단계(조회, 계산, 저장)에서 발생한 {@link RuntimeException}을 해당 단계의
 * {@link Failure}로 변환합니다. 엔진은 이 클래스를 통해서만 저장소와 순수 함수를 호출하므로
 * 예상된 실패 상황에서 예외가 호출자에게 전파되지 않습니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class Steps {

    private Steps() {
    }

    /**
     * 저장소 조회 단계.
     *
     * @param input 조회 기준 (Command, Event 또는 Query)
     * @param step 조회 함수
     * @param <T> 조회 결과 타입
     * @return 조회 결과, 예외 발생 시 FetchFailed
     */
    public static <T> Outcome<T> fetch(Object input, Supplier<? extends T> step) {
        try {
            return Outcome.ok(step.get());
        } catch (RuntimeException e) {
            return Outcome.fail(new Failure.FetchFailed(input, e));
        }
    }

    /**
     * 순수 계산 단계 (decide, evolve, react).
     *
     * @param input 계산 대상
     * @param step 계산 함수
     * @param <T> 계산 결과 타입
     * @return 계산 결과, 예외 발생 시 CalculationFailed
     */
    public static <T> Outcome<T> calculate(Object input, Supplier<? extends T> step) {
        try {
            return Outcome.ok(step.get());
        } catch (RuntimeException e) {
            return Outcome.fail(new Failure.CalculationFailed(input, e));
        }
    }

    /**
     * 저장 단계.
     *
     * @param payload 저장 대상
     * @param step 저장 함수
     * @param <T> 저장 결과 타입
     * @return 저장 결과, 예외 발생 시 StoreFailed
     */
    public static <T> Outcome<T> store(Object payload, Supplier<? extends T> step) {
        try {
            return Outcome.ok(step.get());
        } catch (RuntimeException e) {
            return Outcome.fail(new Failure.StoreFailed(reasonOf(e), payload, e));
        }
    }

    /**
     * 저장 예외를 세부 사유로 분류.
     *
     * @param e 저장소가 던진 예외
     * @return 세부 사유
     */
    public static StoreFailureReason reasonOf(RuntimeException e) {
        if (e instanceof VersionConflictException) {
            return StoreFailureReason.VERSION_CONFLICT;
        }
        if (e instanceof DuplicateSequenceException) {
            return StoreFailureReason.DUPLICATE_SEQUENCE;
        }
        return StoreFailureReason.REJECTED;
    }

    /**
     * Event 목록으로 State 복원.
     *
     * @param decider Decider
     * @param command 처리 중인 Command (실패 보고용)
     * @param state 시작 State
     * @param events 적용할 Event들
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 복원된 State, 예외 발생 시 CalculationFailed
     */
    public static <C, S, E> Outcome<S> fold(Decider<C, S, E> decider, C command, S state, List<E> events) {
        return calculate(command, () -> decider.fold(state, events));
    }

    /**
     * terminal 여부를 확인한 뒤 decide.
     *
     * @param decider Decider
     * @param command 처리할 Command
     * @param state 현재 State
     * @param <C> Command 타입
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 결정된 Event 목록, terminal이면 TerminalStateReached, 예외 발생 시 CalculationFailed
     */
    public static <C, S, E> Outcome<List<E>> decide(Decider<C, S, E> decider, C command, S state) {
        return calculate(command, () -> decider.isTerminal(state))
            .flatMap(terminal -> terminal
                ? Outcome.fail(new Failure.TerminalStateReached(state, command))
                : calculate(command, () -> decider.decide(command, state).collect(Collectors.toList())));
    }
}
