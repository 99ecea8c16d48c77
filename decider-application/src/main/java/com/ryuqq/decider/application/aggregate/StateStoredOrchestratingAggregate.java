package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.config.OrchestrationConfig;
import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.StateRepository;

import java.util.List;

/**
 * Saga로 후속 Command를 이어서 처리하는 State Stored Aggregate.
 *
 * <p>후속 Command는 저장 전의 진행 중인 State를 기준으로 decide되며,
 * 모든 Command가 성공하면 최종 State를 한 번 저장합니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateStoredOrchestratingAggregate<C, S, E> {

    private final Decider<C, S, E> decider;
    private final StateRepository<C, S> repository;
    private final StateOrchestration<C, S, E> orchestration;

    public StateStoredOrchestratingAggregate(Decider<C, S, E> decider,
                                             StateRepository<C, S> repository,
                                             Saga<E, C> saga) {
        this(decider, repository, saga, new OrchestrationConfig());
    }

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param repository State 저장소
     * @param saga 후속 Command를 만드는 Saga
     * @param config Orchestration 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StateStoredOrchestratingAggregate(Decider<C, S, E> decider,
                                             StateRepository<C, S> repository,
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
     * @return 저장된 최종 State
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<S> handle(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchState(command))
            .flatMap(stored -> orchestration.run(command, stored.orElseGet(decider::initialState)))
            .flatMap(newState -> Steps.store(newState, () -> repository.save(newState)));
    }

    public List<Outcome<S>> handleAll(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handle);
    }
}
