package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.Versioned;

import java.util.Optional;

/**
 * State store SPI with optimistic locking and command deduplication.
 *
 * <p>Each command carries a sequence number. The repository records the last applied sequence
 * together with the state and accepts a sequence only when it is exactly the last applied one
 * plus one; replays and gaps are rejected.</p>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <CV> command sequence type
 * @param <SV> state version type
 * @author Decider Team
 * @since 1.0.0
 */
public interface StateLockingDeduplicationRepository<C, S, CV, SV> {

    /**
     * Fetches the current state with its version.
     *
     * @param command the command identifying the state
     * @return the stored state and version, or empty if none was stored yet
     */
    Optional<Versioned<S, SV>> fetchState(C command);

    /**
     * Stores the state for a command sequence.
     *
     * @param state the new state
     * @param commandSequence the sequence number of the command that produced it
     * @param expectedVersion the version read, or {@code null} if no state existed
     * @return the stored state with its new version
     * @throws VersionConflictException if the stored version differs
     * @throws DuplicateSequenceException if the sequence is not the last applied one plus one
     */
    Versioned<S, SV> save(S state, CV commandSequence, SV expectedVersion);
}
