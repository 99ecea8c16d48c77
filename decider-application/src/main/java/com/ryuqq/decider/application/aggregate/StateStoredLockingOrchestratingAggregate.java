package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.config.OrchestrationConfig;
import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.StateLockingRepository;

import java.util.List;

/**
 * Optimistic Locking을 사용하는 Orchestrating State Stored Aggregate.
 *
 * <p>최종 State는 처음 조회한 Version을 기대 Version으로 하여 한 번 저장됩니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateStoredLockingOrchestratingAggregate<C, S, E, V> {

    private final Decider<C, S, E> decider;
    private final StateLockingRepository<C, S, V> repository;
    private final StateOrchestration<C, S, E> orchestration;

    public StateStoredLockingOrchestratingAggregate(Decider<C, S, E> decider,
                                                    StateLockingRepository<C, S, V> repository,
                                                    Saga<E, C> saga) {
        this(decider, repository, saga, new OrchestrationConfig());
    }

    public StateStoredLockingOrchestratingAggregate(Decider<C, S, E> decider,
                                                    StateLockingRepository<C, S, V> repository,
                                                    Saga<E, C> saga,
                                                    OrchestrationConfig config) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (saga == null) {
            throw new IllegalArgumentException("saga cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.decider = decider;
        this.repository = repository;
        this.orchestration = new StateOrchestration<>(decider, saga, config.maxDepth());
    }

    /**
     * Command와 그로부터 파생된 모든 Command 처리.
     *
     * @param command 초기 Command
     * @return 새 Version이 부여된 최종 State
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
                return orchestration.run(command, state)
                    .flatMap(newState -> Steps.store(newState, () -> repository.save(newState, expectedVersion)));
            });
    }

    public List<Outcome<Versioned<S, V>>> handleAllOptimistically(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handleOptimistically);
    }
}
