package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.Versioned;

import java.util.Optional;

/**
 * View state store SPI with optimistic locking and event deduplication.
 *
 * <p>Each event is projected at most once. An event sequence is accepted only when it directly
 * follows the last applied one; replays and gaps are rejected with
 * {@link DuplicateSequenceException}.</p>
 *
 * @param <E> event type
 * @param <S> view state type
 * @param <EV> event sequence type
 * @param <SV> state version type
 * @author Decider Team
 * @since 1.0.0
 */
public interface ViewStateLockingDeduplicationRepository<E, S, EV, SV> {

    Optional<Versioned<S, SV>> fetchState(E event);

    /**
     * Stores the view state for an event sequence.
     *
     * @param state the new view state
     * @param eventSequence the sequence number of the projected event
     * @param expectedVersion the version read, or {@code null} if no state existed
     * @return the stored view state with its new version
     * @throws VersionConflictException if the stored version differs
     * @throws DuplicateSequenceException if the sequence is not the successor of the last applied one
     */
    Versioned<S, SV> save(S state, EV eventSequence, SV expectedVersion);
}
