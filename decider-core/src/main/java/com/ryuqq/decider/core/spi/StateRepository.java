package com.ryuqq.decider.core.spi;

import java.util.Optional;

/**
 * State store SPI for state-stored aggregates and snapshots.
 *
 * @param <C> command type
 * @param <S> state type
 * @author Decider Team
 * @since 1.0.0
 */
public interface StateRepository<C, S> {

    /**
     * Fetches the current state targeted by the command.
     *
     * @param command the command identifying the state
     * @return the stored state, or empty if none was stored yet
     */
    Optional<S> fetchState(C command);

    /**
     * Stores the state, replacing any previous one.
     *
     * @param state the new state
     * @return the stored state
     */
    S save(S state);
}
