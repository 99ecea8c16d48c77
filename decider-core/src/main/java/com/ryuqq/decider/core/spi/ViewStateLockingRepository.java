package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.Versioned;

import java.util.Optional;

/**
 * View state store SPI with optimistic locking.
 *
 * @param <E> event type
 * @param <S> view state type
 * @param <V> version type
 * @author Decider Team
 * @since 1.0.0
 */
public interface ViewStateLockingRepository<E, S, V> {

    Optional<Versioned<S, V>> fetchState(E event);

    /**
     * Stores the view state if the stored version still equals {@code expectedVersion}.
     *
     * @param state the new view state
     * @param expectedVersion the version read, or {@code null} if no state existed
     * @return the stored view state with its new version
     * @throws VersionConflictException if the stored version differs
     */
    Versioned<S, V> save(S state, V expectedVersion);
}
