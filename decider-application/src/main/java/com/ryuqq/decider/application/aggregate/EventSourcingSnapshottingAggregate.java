package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EventSnapshottingRepository;
import com.ryuqq.decider.core.spi.StateRepository;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot을 사용하는 Event Sourcing Aggregate.
 *
 * <p>긴 Event Stream을 매번 처음부터 접지 않도록 마지막 Snapshot 이후의 Event만 조회합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. fetchState(command)                 → 마지막 Snapshot (없으면 initialState)
 * 2. fetchEvents(command, snapshot)      → Snapshot 이후 Event
 * 3. fold → terminal 확인 → decide
 * 4. save(newEvents)
 * 5. shouldCreateNewSnapshot(snapshot, newState)이면 save(newState)
 * </pre>
 *
 * <p>Event 저장 후 Snapshot 저장이 실패하면 StoreFailed를 반환하지만 Event는 이미 저장되어 있습니다.
 * Snapshot은 파생 데이터이므로 다음 호출에서 Snapshot 이후 Event를 접어 같은 State를 얻습니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingSnapshottingAggregate<C, S, E> {

    private final Decider<C, S, E> decider;
    private final EventSnapshottingRepository<C, S, E> eventRepository;
    private final StateRepository<C, S> snapshotRepository;

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param eventRepository Snapshot 이후 조회를 지원하는 Event 저장소
     * @param snapshotRepository Snapshot 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcingSnapshottingAggregate(Decider<C, S, E> decider,
                                              EventSnapshottingRepository<C, S, E> eventRepository,
                                              StateRepository<C, S> snapshotRepository) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (eventRepository == null) {
            throw new IllegalArgumentException("eventRepository cannot be null");
        }
        if (snapshotRepository == null) {
            throw new IllegalArgumentException("snapshotRepository cannot be null");
        }
        this.decider = decider;
        this.eventRepository = eventRepository;
        this.snapshotRepository = snapshotRepository;
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
        return Steps.fetch(command, () -> snapshotRepository.fetchState(command))
            .flatMap(snapshot -> handleFrom(command, snapshot.orElse(null)));
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

    private Outcome<List<E>> handleFrom(C command, S snapshot) {
        S start = Optional.ofNullable(snapshot).orElseGet(decider::initialState);
        return Steps.fetch(command, () -> eventRepository.fetchEvents(command, snapshot))
            .flatMap(events -> Steps.fold(decider, command, start, events))
            .flatMap(state -> Steps.decide(decider, command, state)
                .flatMap(newEvents -> Steps.store(newEvents, () -> eventRepository.save(newEvents)))
                .flatMap(saved -> Steps.fold(decider, command, state, saved)
                    .flatMap(newState -> snapshot(command, snapshot, newState))
                    .map(ignored -> saved)));
    }

    private Outcome<S> snapshot(C command, S latestSnapshot, S newState) {
        return Steps.calculate(command, () -> eventRepository.shouldCreateNewSnapshot(latestSnapshot, newState))
            .flatMap(create -> create
                ? Steps.store(newState, () -> snapshotRepository.save(newState))
                : Outcome.ok(newState));
    }
}
