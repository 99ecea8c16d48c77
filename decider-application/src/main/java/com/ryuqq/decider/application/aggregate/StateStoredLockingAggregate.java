package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.StateLockingRepository;

import java.util.List;

/**
 * Optimistic Locking을 사용하는 State Stored Aggregate.
 *
 * <p>조회한 State의 Version을 기대 Version으로 저장합니다. State가 없었다면 기대 Version은
 * null입니다. 충돌은 StoreFailed(VERSION_CONFLICT)로 반환됩니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateStoredLockingAggregate<C, S, E, V> {

    private final Decider<C, S, E> decider;
    private final StateLockingRepository<C, S, V> repository;

    public StateStoredLockingAggregate(Decider<C, S, E> decider, StateLockingRepository<C, S, V> repository) {
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
     * @return 새 Version이 부여된 State
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<Versioned<S, V>> handleOptimistically(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchState(command))
            .flatMap(stored -> {
                S state = stored.map(Versioned::value).orElseGet(decider::initialState);
                V expectedVersion = stored.map(Versioned::version).orElse(null);
                return Steps.decide(decider, command, state)
                    .flatMap(events -> Steps.fold(decider, command, state, events))
                    .flatMap(newState -> Steps.store(newState, () -> repository.save(newState, expectedVersion)));
            });
    }

    public List<Outcome<Versioned<S, V>>> handleAllOptimistically(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handleOptimistically);
    }
}
