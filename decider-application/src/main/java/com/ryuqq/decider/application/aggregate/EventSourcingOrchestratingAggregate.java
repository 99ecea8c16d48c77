package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.config.OrchestrationConfig;
import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EventRepository;

import java.util.List;

/**
 * Saga로 후속 Command를 이어서 처리하는 Event Sourcing Aggregate.
 *
 * <p>초기 Command의 Event마다 Saga가 후속 Command를 만들고, 후속 Command는 같은 Decider로
 * 다시 decide됩니다. 서로 다른 Command 타입을 이어 붙이려면 {@code Decider.combine}과
 * {@code Saga.combine}으로 결합한 머신을 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 초기 Command부터 깊이 우선 탐색 (조회 → fold → decide → react → 재귀)
 * 2. 탐색이 모두 성공하면 탐색 순서의 모든 Event를 한 번에 저장
 * 3. 어느 단계든 실패하면 아무것도 저장하지 않고 해당 Failure 반환
 * </pre>
 *
 * <p>Saga가 모든 Event에 빈 결과를 반환하면 재귀 없이 초기 Command의 Event만 저장됩니다.
 * 재귀 깊이가 {@link OrchestrationConfig#maxDepth()}를 넘으면 CalculationFailed로 끝납니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingOrchestratingAggregate<C, S, E> {

    private final EventRepository<C, E> repository;
    private final EventOrchestration<C, S, E> orchestration;

    /**
     * 기본 설정으로 생성.
     *
     * @param decider Decider
     * @param repository Event 저장소
     * @param saga 후속 Command를 만드는 Saga
     */
    public EventSourcingOrchestratingAggregate(Decider<C, S, E> decider,
                                               EventRepository<C, E> repository,
                                               Saga<E, C> saga) {
        this(decider, repository, saga, new OrchestrationConfig());
    }

    /**
     * 생성자.
     *
     * @param decider Decider
     * @param repository Event 저장소
     * @param saga 후속 Command를 만드는 Saga
     * @param config Orchestration 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcingOrchestratingAggregate(Decider<C, S, E> decider,
                                               EventRepository<C, E> repository,
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
        this.orchestration = new EventOrchestration<>(decider, saga, repository::fetchEvents, config.maxDepth());
    }

    /**
     * Command와 그로부터 파생된 모든 Command 처리.
     *
     * @param command 초기 Command
     * @return 저장된 모든 새 Event (탐색 순서)
     * @throws IllegalArgumentException command가 null인 경우
     */
    public Outcome<List<E>> handle(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return orchestration.run(command)
            .flatMap(events -> events.isEmpty()
                ? Outcome.ok(events)
                : Steps.store(events, () -> repository.save(events)));
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
