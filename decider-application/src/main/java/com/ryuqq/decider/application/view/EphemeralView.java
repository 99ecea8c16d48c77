package com.ryuqq.decider.application.view;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.View;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.EphemeralViewRepository;

import java.util.List;

/**
 * Ephemeral View.
 *
 * <p>질의 시점에 Event를 조회하여 State를 계산합니다. 계산된 State는 저장하지 않습니다.</p>
 *
 * @param <S> View State 타입
 * @param <E> Event 타입
 * @param <Q> Query 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EphemeralView<S, E, Q> {

    private final View<S, E> view;
    private final EphemeralViewRepository<E, Q> repository;

    public EphemeralView(View<S, E> view, EphemeralViewRepository<E, Q> repository) {
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
     * Query 처리.
     *
     * @param query 조회 조건
     * @return 계산된 View State
     * @throws IllegalArgumentException query가 null인 경우
     */
    public Outcome<S> handle(Q query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        return Steps.fetch(query, () -> repository.fetchEvents(query))
            .flatMap(events -> Steps.calculate(query, () -> view.fold(view.initialState(), events)));
    }

    public List<Outcome<S>> handleAll(Iterable<? extends Q> queries) {
        return Batches.each(queries, this::handle);
    }
}
