package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.Versioned;

import java.util.Optional;

/**
 * State store SPI with optimistic locking.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <V> version type
 * @author Decider Team
 * @since 1.0.0
 */
public interface StateLockingRepository<C, S, V> {

    /**
     * Fetches the current state with its version.
     *
     * @param command the command identifying the state
     * @return the stored state and version, or empty if none was stored yet
     */
    Optional<Versioned<S, V>> fetchState(C command);

    /**
     * Stores the state if the stored version still equals {@code expectedVersion}.
     *
     * @param state the new state
     * @param expectedVersion the version read, or {@code null} if no state existed
     * @return the stored state with its new version
     * @throws VersionConflictException if the stored version differs
     */
    Versioned<S, V> save(S state, V expectedVersion);
}
