package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.ViewStateLockingRepository;

import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory implementation of {@link ViewStateLockingRepository}.
 *
 * <p>Follows the same version rules as {@link InMemoryLockingStateRepository}.</p>
 *
 * @param <E> Event type
 * @param <S> View state type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryLockingViewStateRepository<E, S, K> implements ViewStateLockingRepository<E, S, Long> {

    private final Function<? super E, ? extends K> eventKey;
    private final Function<? super S, ? extends K> stateKey;
    private final VersionedStateStore<K, S> store = new VersionedStateStore<>(VersionedStateStore.SequenceRule.NONE);

    public InMemoryLockingViewStateRepository(Function<? super E, ? extends K> eventKey,
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
    public Versioned<S, Long> save(S state, Long expectedVersion) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return store.save(stateKey.apply(state), state, null, expectedVersion);
    }

    public void clear() {
        store.clear();
    }
}
