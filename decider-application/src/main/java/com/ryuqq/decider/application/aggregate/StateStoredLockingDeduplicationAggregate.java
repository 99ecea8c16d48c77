package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.model.Pair;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.StateLockingDeduplicationRepository;

import java.util.List;

/**
 * Optimistic Locking과 Command 중복 제거를 사용하는 State Stored Aggregate.
 *
 * <p>Command마다 Sequence 번호를 함께 전달합니다. 이미 적용된 Sequence는 저장소가 거부하며
 * StoreFailed(DUPLICATE_SEQUENCE)로 반환됩니다. At-least-once로 전달되는 Command를
 * 정확히 한 번만 적용할 때 사용합니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 * @param <CV> Command Sequence 타입
 * @param <SV> State Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateStoredLockingDeduplicationAggregate<C, S, E, CV, SV> {

    private final Decider<C, S, E> decider;
    private final StateLockingDeduplicationRepository<C, S, CV, SV> repository;

    public StateStoredLockingDeduplicationAggregate(Decider<C, S, E> decider,
                                                    StateLockingDeduplicationRepository<C, S, CV, SV> repository) {
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
     * @param commandSequence Command의 Sequence 번호
     * @return 새 Version이 부여된 State
     * @throws IllegalArgumentException command 또는 commandSequence가 null인 경우
     */
    public Outcome<Versioned<S, SV>> handleOptimistically(C command, CV commandSequence) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (commandSequence == null) {
            throw new IllegalArgumentException("commandSequence cannot be null");
        }
        return Steps.fetch(command, () -> repository.fetchState(command))
            .flatMap(stored -> {
                S state = stored.map(Versioned::value).orElseGet(decider::initialState);
                SV expectedVersion = stored.map(Versioned::version).orElse(null);
                return Steps.decide(decider, command, state)
                    .flatMap(events -> Steps.fold(decider, command, state, events))
                    .flatMap(newState -> Steps.store(newState,
                        () -> repository.save(newState, commandSequence, expectedVersion)));
            });
    }

    /**
     * 여러 Command를 순서대로 처리.
     *
     * @param commands (Command, Sequence) 시퀀스
     * @return Command별 Outcome (입력 순서)
     */
    public List<Outcome<Versioned<S, SV>>> handleAllOptimistically(Iterable<? extends Pair<C, CV>> commands) {
        return Batches.each(commands, pair -> handleOptimistically(pair.first(), pair.second()));
    }
}
