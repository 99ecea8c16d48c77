package com.ryuqq.decider.application.view;

import com.ryuqq.decider.application.support.Batches;
import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.View;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.spi.ViewStateRepository;

import java.util.List;

/**
 * Materialized View.
 *
 * <p>Event를 받을 때마다 저장된 View State에 적용하고 다시 저장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. fetchState(event)      → 저장된 State (없으면 initialState)
 * 2. evolve(state, event)   → 새 State (실패 시 CalculationFailed)
 * 3. save(newState)
 * </pre>
 *
 * @param <S> View State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class MaterializedView<S, E> {

    private final View<S, E> view;
    private final ViewStateRepository<E, S> repository;

    /**
     * 생성자.
     *
     * @param view View
     * @param repository View State 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MaterializedView(View<S, E> view, ViewStateRepository<E, S> repository) {
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
     * @return 저장된 새 View State
     * @throws IllegalArgumentException event가 null인 경우
     */
    public Outcome<S> handle(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return Steps.fetch(event, () -> repository.fetchState(event))
            .flatMap(stored -> Steps.calculate(event,
                () -> view.evolve(stored.orElseGet(view::initialState), event)))
            .flatMap(newState -> Steps.store(newState, () -> repository.save(newState)));
    }

    /**
     * 여러 Event를 순서대로 처리.
     *
     * @param events Event 시퀀스
     * @return Event별 Outcome (입력 순서)
     */
    public List<Outcome<S>> handleAll(Iterable<? extends E> events) {
        return Batches.each(events, this::handle);
    }
}
