package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;

import java.util.List;
import java.util.stream.Collectors;

/**
 * State Stored Orchestration의 재귀 계산.
 *
 * <p>Command를 decide하여 State에 적용한 뒤, 각 Event에서 Saga가 만든 Command를
 * 깊이 우선으로 같은 State 위에 이어서 적용합니다. 저장소는 호출하지 않습니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
final class StateOrchestration<C, S, E> {

    private final Decider<C, S, E> decider;
    private final Saga<E, C> saga;
    private final int maxDepth;

    StateOrchestration(Decider<C, S, E> decider, Saga<E, C> saga, int maxDepth) {
        this.decider = decider;
        this.saga = saga;
        this.maxDepth = maxDepth;
    }

    /**
     * 초기 Command와 파생된 모든 Command를 적용한 State 계산.
     *
     * @param command 초기 Command
     * @param state 저장된 State (없으면 initialState)
     * @return 최종 State
     */
    Outcome<S> run(C command, S state) {
        return visit(command, state, 0);
    }

    private Outcome<S> visit(C command, S state, int depth) {
        if (depth > maxDepth) {
            return Outcome.fail(new Failure.CalculationFailed(command, new SagaDepthExceededException(maxDepth, command)));
        }
        Outcome<List<E>> decision = Steps.decide(decider, command, state);
        if (decision.isFail()) {
            return Outcome.fail(decision.failureOrNull());
        }
        List<E> events = decision.getOrThrow();
        Outcome<S> running = Steps.fold(decider, command, state, events);
        if (running.isFail()) {
            return running;
        }

        for (E event : events) {
            Outcome<List<C>> reaction = Steps.calculate(event, () -> saga.react(event).collect(Collectors.toList()));
            if (reaction.isFail()) {
                return Outcome.fail(reaction.failureOrNull());
            }
            for (C next : reaction.getOrThrow()) {
                running = visit(next, running.getOrThrow(), depth + 1);
                if (running.isFail()) {
                    return running;
                }
            }
        }
        return running;
    }
}
