package com.ryuqq.decider.core.spi;

import java.util.Optional;

/**
 * View state store SPI for materialized views.
 *
 * @param <E> event type
 * @param <S> view state type
 * @author Decider Team
 * @since 1.0.0
 */
public interface ViewStateRepository<E, S> {

    /**
     * Fetches the view state the event projects into.
     *
     * @param event the event identifying the view
     * @return the stored view state, or empty if none was stored yet
     */
    Optional<S> fetchState(E event);

    /**
     * Stores the view state.
     *
     * @param state the new view state
     * @return the stored view state
     */
    S save(S state);
}
