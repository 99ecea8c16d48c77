package com.ryuqq.decider.core.spi;

import java.util.List;

/**
 * Read-only event source for ephemeral views.
 *
 * @param <E> event type
 * @param <Q> query type
 * @author Decider Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EphemeralViewRepository<E, Q> {

    /**
     * Fetches the events that answer a query.
     *
     * @param query the query
     * @return events in append order
     */
    List<E> fetchEvents(Q query);
}
