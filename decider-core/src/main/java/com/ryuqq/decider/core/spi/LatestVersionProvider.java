package com.ryuqq.decider.core.spi;

/**
 * Supplies the current stream version for the stream an event belongs to.
 *
 * <p>Used by orchestrating aggregates, which save events of several streams at once and therefore
 * cannot carry a single expected version from their fetch step.</p>
 *
 * @param <E> event type
 * @param <V> version type
 * @author Decider Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LatestVersionProvider<E, V> {

    /**
     * Returns the latest stored version of the stream the event belongs to.
     *
     * @param event the event about to be appended
     * @return the latest version, or {@code null} if the stream is empty
     */
    V latestVersion(E event);
}
