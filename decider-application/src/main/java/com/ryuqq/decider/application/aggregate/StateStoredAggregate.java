package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.StateRepository;

import java.util.List;

/**
 * State Stored Aggregate.
 *
 * <p>Event 대신 현재 State를 저장합니다. decide 결과 Event는 저장되지 않고
 * 새 State를 계산하는 데만 사용됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. fetchState(command)       → 저장된 State (없으면 initialState)
 * 2. isTerminal(state)         → terminal이면 TerminalStateReached
 * 3. decide(command, state)    → Event
 * 4. fold(state, events)       → 새 State
 * 5. save(newState)
 * </pre>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateStoredAggregate<C, S, E> {

    private final Decider<C, S, E> decider;
    private final StateRepository<C, S> repository;

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param repository State 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StateStoredAggregate(Decider<C, S, E> decider, StateRepository<C, S> repository) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.decider = decider;
        this.repository = repository;
    }

    /**
     * Command 처리.
     *
     * @param command 처리할 Command
     * @return 저장된 새 State
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<S> handle(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchState(command))
            .flatMap(stored -> computeNewState(command, stored.orElseGet(decider::initialState)))
            .flatMap(newState -> Steps.store(newState, () -> repository.save(newState)));
    }

    public List<Outcome<S>> handleAll(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handle);
    }

    private Outcome<S> computeNewState(C command, S state) {
        return Steps.decide(decider, command, state)
            .flatMap(events -> Steps.fold(decider, command, state, events));
    }
}
