package com.ryuqq.decider.application.view;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.View;
import com.ryuqq.decider.core.model.Pair;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.ViewStateLockingDeduplicationRepository;

import java.util.List;

/**
 * Optimistic Locking과 Event 중복 제거를 사용하는 Materialized View.
 *
 * <p>Event마다 Sequence 번호를 함께 전달합니다. 저장소는 마지막으로 적용된 Sequence의 바로 다음
 * 번호만 받아들이므로, 같은 Event를 다시 전달하면 StoreFailed(DUPLICATE_SEQUENCE)가 반환되고
 * View State는 바뀌지 않습니다.</p>
 *
 * @param <S> View State 타입
 * @param <E> Event 타입
 * @param <EV> Event Sequence 타입
 * @param <SV> State Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class MaterializedLockingDeduplicationView<S, E, EV, SV> {

    private final View<S, E> view;
    private final ViewStateLockingDeduplicationRepository<E, S, EV, SV> repository;

    public MaterializedLockingDeduplicationView(View<S, E> view,
                                                ViewStateLockingDeduplicationRepository<E, S, EV, SV> repository) {
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
     * @param eventSequence Event의 Sequence 번호
     * @return 새 Version이 부여된 View State
     * @throws IllegalArgumentException event 또는 eventSequence가 null인 경우
     */
    public Outcome<Versioned<S, SV>> handleOptimistically(E event, EV eventSequence) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (eventSequence == null) {
            throw new IllegalArgumentException("eventSequence cannot be null");
        }
        return Steps.fetch(event, () -> repository.fetchState(event))
            .flatMap(stored -> {
                S state = stored.map(Versioned::value).orElseGet(view::initialState);
                SV expectedVersion = stored.map(Versioned::version).orElse(null);
                return Steps.calculate(event, () -> view.evolve(state, event))
                    .flatMap(newState -> Steps.store(newState,
                        () -> repository.save(newState, eventSequence, expectedVersion)));
            });
    }

    /**
     * 여러 Event를 순서대로 처리.
     *
     * @param events (Event, Sequence) 시퀀스
     * @return Event별 Outcome (입력 순서)
     */
    public List<Outcome<Versioned<S, SV>>> handleAllOptimistically(Iterable<? extends Pair<E, EV>> events) {
        return Batches.each(events, pair -> handleOptimistically(pair.first(), pair.second()));
    }
}
