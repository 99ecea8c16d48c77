package com.ryuqq.decider.application.saga;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.ActionPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Saga Manager.
 *
 * <p>Action Result(보통 다른 Aggregate의 Event)에 Saga를 적용하고,
 * 만들어진 Action을 순서대로 발행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. react(actionResult)   → Action 목록 (실패 시 CalculationFailed)
 * 2. publish(action) 반복   → 발행된 Action (실패 시 StoreFailed, 남은 Action은 발행하지 않음)
 * </pre>
 *
 * @param <AR> Action Result 타입
 * @param <A> Action 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class SagaManager<AR, A> {

    private final Saga<AR, A> saga;
    private final ActionPublisher<A> publisher;

    /**
     * 생성자.
     *
     * @param saga Saga
     * @param publisher Action 발행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SagaManager(Saga<AR, A> saga, ActionPublisher<A> publisher) {
        if (saga == null) {
            throw new IllegalArgumentException("saga cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        this.saga = saga;
        this.publisher = publisher;
    }

    /**
     * Action Result 처리.
     *
     * @param actionResult 처리할 Action Result
     * @return 발행된 Action 목록
     * @throws IllegalArgumentException actionResult가 null인 경우
     */
    public Outcome<List<A>> handle(AR actionResult) {
        if (actionResult == null) {
            throw new IllegalArgumentException("actionResult cannot be null");
        }
        return Steps.calculate(actionResult, () -> saga.react(actionResult).collect(Collectors.toList()))
            .flatMap(this::publishAll);
    }

    /**
     * 여러 Action Result를 순서대로 처리.
     *
     * @param actionResults Action Result 시퀀스
     * @return 입력별 Outcome (입력 순서)
     */
    public List<Outcome<List<A>>> handleAll(Iterable<? extends AR> actionResults) {
        return Batches.each(actionResults, this::handle);
    }

    private Outcome<List<A>> publishAll(List<A> actions) {
        List<A> published = new ArrayList<>(actions.size());
        for (A action : actions) {
            Outcome<A> outcome = Steps.store(action, () -> publisher.publish(action));
            if (outcome.isFail()) {
                return Outcome.fail(outcome.failureOrNull());
            }
            published.add(outcome.getOrThrow());
        }
        return Outcome.ok(published);
    }
}
