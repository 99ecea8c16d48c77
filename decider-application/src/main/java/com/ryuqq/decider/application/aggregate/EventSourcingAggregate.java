package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EventRepository;

import java.util.List;

/**
 * Event Sourcing Aggregate.
 *
 * <p>저장된 Event를 접어 현재 State를 복원하고, Command를 decide하여 새 Event를 저장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. fetchEvents(command)          → 저장된 Event (실패 시 FetchFailed)
 * 2. fold(initialState, events)    → 현재 State (실패 시 CalculationFailed)
 * 3. isTerminal(state)             → terminal이면 TerminalStateReached
 * 4. decide(command, state)        → 새 Event (실패 시 CalculationFailed)
 * 5. save(newEvents)               → 저장된 Event (실패 시 StoreFailed)
 * </pre>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingAggregate<C, S, E> {

    private final Decider<C, S, E> decider;
    private final EventRepository<C, E> repository;

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param repository Event 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcingAggregate(Decider<C, S, E> decider, EventRepository<C, E> repository) {
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
     * @return 저장된 새 Event 목록
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<List<E>> handle(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchEvents(command))
            .flatMap(events -> Steps.fold(decider, command, decider.initialState(), events))
            .flatMap(state -> Steps.decide(decider, command, state))
            .flatMap(newEvents -> Steps.store(newEvents, () -> repository.save(newEvents)));
    }

    /**
     * 여러 Command를 순서대로 처리.
     *
     * @param commands Command 시퀀스
     * @return Command별 Outcome (입력 순서)
     */
    public List<Outcome<List<E>>> handleAll(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handle);
    }
}
