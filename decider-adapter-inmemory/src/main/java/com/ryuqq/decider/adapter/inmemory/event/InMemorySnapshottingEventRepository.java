package com.ryuqq.decider.adapter.inmemory.event;

import com.ryuqq.decider.core.spi.EventSnapshottingRepository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link EventSnapshottingRepository}.
 *
 * <p>A new snapshot is requested every {@code snapshotInterval} events. When it requests one, the
 * repository remembers the stream position the snapshot state stands for, and later serves only the
 * events appended after that position. Snapshots themselves live in a separate
 * {@link com.ryuqq.decider.core.spi.StateRepository}.</p>
 *
 * <p>Positions are remembered per state value. Two equal states at different positions fold the
 * remaining events to the same result, so either position may be served.</p>
 *
 * @param <C> Command type
 * @param <S> State (snapshot) type
 * @param <E> Event type
 * @param <K> Stream key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemorySnapshottingEventRepository<C, S, E, K> extends InMemoryEventRepository<C, E, K>
    implements EventSnapshottingRepository<C, S, E> {

    private final Function<? super S, ? extends K> stateKey;
    private final int snapshotInterval;
    private final ConcurrentHashMap<K, Map<S, Integer>> positions = new ConcurrentHashMap<>();

    /**
     * Creates an empty repository.
     *
     * @param commandKey resolves the stream a command reads
     * @param eventKey resolves the stream an event is appended to
     * @param stateKey resolves the stream a snapshot state belongs to
     * @param snapshotInterval number of events between snapshots (positive)
     * @throws IllegalArgumentException if an extractor is null or the interval is not positive
     */
    public InMemorySnapshottingEventRepository(Function<? super C, ? extends K> commandKey,
                                               Function<? super E, ? extends K> eventKey,
                                               Function<? super S, ? extends K> stateKey,
                                               int snapshotInterval) {
        super(commandKey, eventKey);
        if (stateKey == null) {
            throw new IllegalArgumentException("stateKey cannot be null");
        }
        if (snapshotInterval <= 0) {
            throw new IllegalArgumentException("snapshotInterval must be positive");
        }
        this.stateKey = stateKey;
        this.snapshotInterval = snapshotInterval;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the snapshot was never announced by {@link #shouldCreateNewSnapshot}
     */
    @Override
    public List<E> fetchEvents(C command, S snapshot) {
        List<E> stream = fetchEvents(command);
        if (snapshot == null) {
            return stream;
        }
        Integer position = positionOf(snapshot);
        if (position == null) {
            throw new IllegalStateException("Unknown snapshot " + snapshot);
        }
        return stream.subList(Math.min(position, stream.size()), stream.size());
    }

    @Override
    public boolean shouldCreateNewSnapshot(S latestSnapshot, S newState) {
        K key = stateKey.apply(newState);
        int size = streamOf(key).size();
        Integer latest = latestSnapshot == null ? Integer.valueOf(0) : positionOf(latestSnapshot);
        if (latest != null && size - latest < snapshotInterval) {
            return false;
        }
        positions.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(newState, size);
        return true;
    }

    @Override
    public void clear() {
        super.clear();
        positions.clear();
    }

    private Integer positionOf(S snapshot) {
        Map<S, Integer> known = positions.get(stateKey.apply(snapshot));
        return known == null ? null : known.get(snapshot);
    }
}
