package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.config.OrchestrationConfig;
import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EventLockingRepository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Optimistic Locking을 사용하는 Orchestrating Event Sourcing Aggregate.
 *
 * <p>탐색은 {@link EventSourcingOrchestratingAggregate}와 같습니다. 한 번의 Orchestration이
 * 여러 Stream에 Event를 추가할 수 있으므로, 저장 시에는 저장소의
 * {@link EventLockingRepository#latestVersionProvider()}로 각 Event가 속한 Stream의
 * 최신 Version을 조회합니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingLockingOrchestratingAggregate<C, S, E, V> {

    private final EventLockingRepository<C, E, V> repository;
    private final EventOrchestration<C, S, E> orchestration;

    public EventSourcingLockingOrchestratingAggregate(Decider<C, S, E> decider,
                                                      EventLockingRepository<C, E, V> repository,
                                                      Saga<E, C> saga) {
        this(decider, repository, saga, new OrchestrationConfig());
    }

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param repository Locking Event 저장소
     * @param saga 후속 Command를 만드는 Saga
     * @param config Orchestration 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcingLockingOrchestratingAggregate(Decider<C, S, E> decider,
                                                      EventLockingRepository<C, E, V> repository,
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
        this.repository = repository;
        this.orchestration = new EventOrchestration<>(
            decider,
            saga,
            command -> repository.fetchEvents(command).stream().map(Versioned::value).collect(Collectors.toList()),
            config.maxDepth()
        );
    }

    /**
     * Command와 그로부터 파생된 모든 Command 처리.
     *
     * @param command 초기 Command
     * @return Version이 부여된 모든 새 Event (탐색 순서)
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<List<Versioned<E, V>>> handleOptimistically(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return orchestration.run(command)
            .flatMap(events -> events.isEmpty()
                ? Outcome.<List<Versioned<E, V>>>ok(List.of())
                : Steps.store(events, () -> repository.save(events, repository.latestVersionProvider())));
    }

    public List<Outcome<List<Versioned<E, V>>>> handleAllOptimistically(Iterable<? extends C> commands) {
        return Batches.each(commands, this::handleOptimistically);
    }
}
