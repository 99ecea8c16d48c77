package com.ryuqq.decider.adapter.inmemory.event;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.EventLockingRepository;
import com.ryuqq.decider.core.spi.LatestVersionProvider;
import com.ryuqq.decider.core.spi.VersionConflictException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link EventLockingRepository} with optimistic locking.
 *
 * <p>Every stream numbers its events 1..n. An append succeeds only when the caller's expected
 * version equals the version of the last event in the stream ({@code null} for an empty stream);
 * otherwise it throws {@link VersionConflictException} and writes nothing.</p>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Version check and append run atomically per stream inside {@link ConcurrentHashMap#compute}</li>
 *   <li>Of several writers holding the same expected version exactly one succeeds</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>A single {@code save(events, version)} call must target one stream</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @param <C> Command type
 * @param <E> Event type
 * @param <K> Stream key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryLockingEventRepository<C, E, K> implements EventLockingRepository<C, E, Long> {

    private final Function<? super C, ? extends K> commandKey;
    private final Function<? super E, ? extends K> eventKey;
    private final ConcurrentHashMap<K, List<Versioned<E, Long>>> streams = new ConcurrentHashMap<>();

    /**
     * Creates an empty repository.
     *
     * @param commandKey resolves the stream a command reads
     * @param eventKey resolves the stream an event is appended to
     * @throws IllegalArgumentException if either extractor is null
     */
    public InMemoryLockingEventRepository(Function<? super C, ? extends K> commandKey,
                                          Function<? super E, ? extends K> eventKey) {
        if (commandKey == null) {
            throw new IllegalArgumentException("commandKey cannot be null");
        }
        if (eventKey == null) {
            throw new IllegalArgumentException("eventKey cannot be null");
        }
        this.commandKey = commandKey;
        this.eventKey = eventKey;
    }

    @Override
    public List<Versioned<E, Long>> fetchEvents(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return streamOf(commandKey.apply(command));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>All events must resolve to the same stream</li>
     *   <li>New versions continue from the last version of the stream</li>
     *   <li>An empty list is a no-op and skips the version check</li>
     * </ul>
     *
     * @throws VersionConflictException if {@code latestVersion} is not the stream's last version
     * @throws IllegalArgumentException if the events span several streams
     */
    @Override
    public List<Versioned<E, Long>> save(List<E> events, Long latestVersion) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (events.isEmpty()) {
            return List.of();
        }
        K key = eventKey.apply(events.get(0));
        for (E event : events) {
            if (!key.equals(eventKey.apply(event))) {
                throw new IllegalArgumentException("events must belong to a single stream");
            }
        }

        List<Versioned<E, Long>> saved = new ArrayList<>(events.size());
        streams.compute(key, (k, stream) -> {
            List<Versioned<E, Long>> current = stream == null ? new ArrayList<>() : stream;
            Long actual = lastVersion(current);
            if (!Objects.equals(actual, latestVersion)) {
                throw new VersionConflictException(latestVersion, actual);
            }
            long next = actual == null ? 1L : actual + 1;
            for (E event : events) {
                saved.add(Versioned.of(event, next++));
            }
            current.addAll(saved);
            return current;
        });
        return List.copyOf(saved);
    }

    @Override
    public LatestVersionProvider<E, Long> latestVersionProvider() {
        return event -> lastVersion(streamOf(eventKey.apply(event)));
    }

    /**
     * Returns a snapshot of one stream.
     *
     * @param key stream key
     * @return versioned events in append order, empty if the stream does not exist
     */
    public List<Versioned<E, Long>> streamOf(K key) {
        List<Versioned<E, Long>> copy = new ArrayList<>();
        streams.computeIfPresent(key, (k, stream) -> {
            copy.addAll(stream);
            return stream;
        });
        return List.copyOf(copy);
    }

    /**
     * Removes every stream.
     */
    public void clear() {
        streams.clear();
    }

    private static <E> Long lastVersion(List<Versioned<E, Long>> stream) {
        return stream.isEmpty() ? null : stream.get(stream.size() - 1).version();
    }
}
