package com.ryuqq.decider.application.view;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.View;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.ViewStateLockingRepository;

import java.util.List;

/**
 * Optimistic Locking을 사용하는 Materialized View.
 *
 * <p>같은 View를 여러 Consumer가 동시에 갱신할 때, 늦은 쪽은 StoreFailed(VERSION_CONFLICT)를 받습니다.</p>
 *
 * @param <S> View State 타입
 * @param <E> Event 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class MaterializedLockingView<S, E, V> {

    private final View<S, E> view;
    private final ViewStateLockingRepository<E, S, V> repository;

    public MaterializedLockingView(View<S, E> view, ViewStateLockingRepository<E, S, V> repository) {
        if (view == null) {
            throw new IllegalArgumentException("view cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.view = view;
        this.repository = repository;
    }

    /**
     * Event 처리.
     *
     * @param event 적용할 Event
     * @return 새 Version이 부여된 View State
     * @throws IllegalArgumentException event가 null인 경우
     */
    public Outcome<Versioned<S, V>> handleOptimistically(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return Steps.fetch(event, () -> repository.fetchState(event))
            .flatMap(stored -> {
                S state = stored.map(Versioned::value).orElseGet(view::initialState);
                V expectedVersion = stored.map(Versioned::version).orElse(null);
                return Steps.calculate(event, () -> view.evolve(state, event))
                    .flatMap(newState -> Steps.store(newState, () -> repository.save(newState, expectedVersion)));
            });
    }

    public List<Outcome<Versioned<S, V>>> handleAllOptimistically(Iterable<? extends E> events) {
        return Batches.each(events, this::handleOptimistically);
    }
}
