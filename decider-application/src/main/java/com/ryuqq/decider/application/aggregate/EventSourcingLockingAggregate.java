package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EventLockingRepository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Optimistic Locking을 사용하는 Event Sourcing Aggregate.
 *
 * <p>조회한 마지막 Event의 Version을 저장 시 기대 Version으로 전달합니다.
 * 그 사이 다른 writer가 Event를 추가했다면 저장은 StoreFailed(VERSION_CONFLICT)로 끝나며,
 * 엔진은 재시도하지 않습니다. 재시도가 필요하면 호출자가 다시 handleOptimistically를 호출합니다.</p>
 *
 * <p>decide 결과가 비어 있으면 저장소를 호출하지 않고 빈 목록을 반환합니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingLockingAggregate<C, S, E, V> {

    private final Decider<C, S, E> decider;
    private final EventLockingRepository<C, E, V> repository;

    public EventSourcingLockingAggregate(Decider<C, S, E> decider, EventLockingRepository<C, E, V> repository) {
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
     * @return Version이 부여된 새 Event 목록
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<List<Versioned<E, V>>> handleOptimistically(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchEvents(command))
            .flatMap(stored -> {
                V latestVersion = stored.isEmpty() ? null : stored.get(stored.size() - 1).version();
                List<E> events = stored.stream().map(Versioned::value).collect(Collectors.toList());
                return Steps.fold(decider, command, decider.initialState(), events)
                    .flatMap(state -> Steps.decide(decider, command, state))
                    .flatMap(newEvents -> save(newEvents, latestVersion));
            });
    }

    /**
     * 여러 Command를 순서대로 처리.
     *
     * @param commands Command 시퀀스
     * @return Command별 Outcome (입력 순서)
     */
    public List<Outcome<List<Versioned<E, V>>>> handleAllOptimistically(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handleOptimistically);
    }

    private Outcome<List<Versioned<E, V>>> save(List<E> newEvents, V latestVersion) {
        if (newEvents.isEmpty()) {
            return Outcome.ok(List.of());
        }
        return Steps.store(newEvents, () -> repository.save(newEvents, latestVersion));
    }
}
