package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.DuplicateSequenceException;
import com.ryuqq.decider.core.spi.ViewStateLockingDeduplicationRepository;

import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory implementation of {@link ViewStateLockingDeduplicationRepository}.
 *
 * <p>Event sequences of a view start at 1. A sequence is accepted only when it is exactly the last
 * accepted sequence plus one, so both a redelivered event and a gap fail with
 * {@link DuplicateSequenceException} and leave the view untouched.</p>
 *
 * @param <E> Event type
 * @param <S> View state type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryDeduplicatingViewStateRepository<E, S, K>
    implements ViewStateLockingDeduplicationRepository<E, S, Long, Long> {

    private final Function<? super E, ? extends K> eventKey;
    private final Function<? super S, ? extends K> stateKey;
    private final VersionedStateStore<K, S> store =
        new VersionedStateStore<>(VersionedStateStore.SequenceRule.CONSECUTIVE);

    public InMemoryDeduplicatingViewStateRepository(Function<? super E, ? extends K> eventKey,
                                                    Function<? super S, ? extends K> stateKey) {
        if (eventKey == null) {
            throw new IllegalArgumentException("eventKey cannot be null");
        }
        if (stateKey == null) {
            throw new IllegalArgumentException("stateKey cannot be null");
        }
        this.eventKey = eventKey;
        this.stateKey = stateKey;
    }

    @Override
    public Optional<Versioned<S, Long>> fetchState(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return store.fetch(eventKey.apply(event));
    }

    @Override
    public Versioned<S, Long> save(S state, Long eventSequence, Long expectedVersion) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return store.save(stateKey.apply(state), state, eventSequence, expectedVersion);
    }

    public void clear() {
        store.clear();
    }
}
