package com.ryuqq.decider.core.spi;

import java.util.ArrayList;
import java.util.List;

/**
 * Event store SPI for event-sourced aggregates.
 *
 * <p>An event stream is identified by the command that targets it. Implementations decide how a
 * command maps to a stream (typically by an aggregate id carried on the command).</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Order: {@link #fetchEvents(Object)} returns events in the order they were appended</li>
 *   <li>Thread-safe: methods may be called concurrently for different streams</li>
 *   <li>Failures: any {@link RuntimeException} is reported to the caller as a typed failure</li>
 * </ul>
 *
 * @param <C> command type
 * @param <E> event type
 * @author Decider Team
 * @since 1.0.0
 */
public interface EventRepository<C, E> {

    /**
     * Fetches the full event stream that the given command targets.
     *
     * @param command the command identifying the stream
     * @return events in append order, empty if the stream does not exist yet
     */
    List<E> fetchEvents(C command);

    /**
     * Appends one event to its stream.
     *
     * @param event the event to append
     * @return the stored event
     */
    E save(E event);

    /**
     * Appends events in the given order.
     *
     * <p>The default implementation saves one event at a time. Implementations backed by a
     * transactional store should override this to append the batch atomically.</p>
     *
     * @param events the events to append
     * @return the stored events, in order
     */
    default List<E> save(List<E> events) {
        List<E> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.add(save(event));
        }
        return saved;
    }
}
