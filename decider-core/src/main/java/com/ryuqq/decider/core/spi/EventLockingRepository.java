package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.Versioned;

import java.util.ArrayList;
import java.util.List;

/**
 * Event store SPI with optimistic locking.
 *
 * <p>Every stored event carries the stream version it was written at. A writer passes the version
 * of the last event it read; if another writer appended in the meantime the save fails with
 * {@link VersionConflictException} and nothing is written.</p>
 *
 * <p><strong>Optimistic Locking Protocol:</strong></p>
 * <pre>
 * 1. fetchEvents(command)           → [(e1, v1) ... (en, vn)]
 * 2. decide against fold(e1..en)    → new events
 * 3. save(newEvents, vn)            → appended at vn+1 ... or VersionConflictException
 * </pre>
 *
 * @param <C> command type
 * @param <E> event type
 * @param <V> version type
 * @author Decider Team
 * @since 1.0.0
 */
public interface EventLockingRepository<C, E, V> {

    /**
     * Fetches the stream with the version of every event.
     *
     * @param command the command identifying the stream
     * @return versioned events in append order, empty if the stream does not exist yet
     */
    List<Versioned<E, V>> fetchEvents(C command);

    /**
     * Appends events if the stream is still at {@code latestVersion}.
     *
     * @param events the events to append, all belonging to one stream
     * @param latestVersion the version of the last event read, or {@code null} if the stream was empty
     * @return the appended events with their new versions
     * @throws VersionConflictException if the stream has moved past {@code latestVersion}
     */
    List<Versioned<E, V>> save(List<E> events, V latestVersion);

    /**
     * Provider used when the caller has no expected version of its own.
     *
     * @return provider of the latest stored version per stream
     */
    LatestVersionProvider<E, V> latestVersionProvider();

    /**
     * Appends events one at a time, each at the version the provider reports for its stream.
     *
     * <p>Orchestrating aggregates use this form because one orchestration may append to several
     * streams.</p>
     *
     * <p>The call is not atomic across events. Each append is committed before the next lookup,
     * so a conflict on a later event leaves the earlier events of the same call stored.</p>
     *
     * @param events the events to append
     * @param provider latest-version lookup
     * @return the appended events with their new versions, in order
     * @throws VersionConflictException if a stream moved between lookup and append; events
     *         appended before the conflicting one stay persisted
     */
    default List<Versioned<E, V>> save(List<E> events, LatestVersionProvider<E, V> provider) {
        List<Versioned<E, V>> saved = new ArrayList<>(events.size());
        for (E event : events) {
            saved.addAll(save(List.of(event), provider.latestVersion(event)));
        }
        return saved;
    }
}
