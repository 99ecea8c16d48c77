package com.ryuqq.decider.core.spi;

import java.util.List;

/**
 * Event store SPI that can read a stream starting after a snapshot.
 *
 * @param <C> command type
 * @param <S> snapshot state type
 * @param <E> event type
 * @author Decider Team
 * @since 1.0.0
 */
public interface EventSnapshottingRepository<C, S, E> extends EventRepository<C, E> {

    /**
     * Fetches the events appended after the given snapshot was taken.
     *
     * @param command the command identifying the stream
     * @param snapshot the latest snapshot, or {@code null} if none exists
     * @return events after the snapshot in append order
     */
    List<E> fetchEvents(C command, S snapshot);

    /**
     * Decides whether a new snapshot should be stored.
     *
     * @param latestSnapshot the snapshot read before deciding, or {@code null}
     * @param newState the state after the new events
     * @return {@code true} to store {@code newState} as the new snapshot
     */
    default boolean shouldCreateNewSnapshot(S latestSnapshot, S newState) {
        return true;
    }
}
