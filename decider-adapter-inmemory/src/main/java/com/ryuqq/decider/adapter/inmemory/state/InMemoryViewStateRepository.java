package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.spi.ViewStateRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link ViewStateRepository}.
 *
 * @param <E> Event type
 * @param <S> View state type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryViewStateRepository<E, S, K> implements ViewStateRepository<E, S> {

    private final Function<? super E, ? extends K> eventKey;
    private final Function<? super S, ? extends K> stateKey;
    private final ConcurrentHashMap<K, S> states = new ConcurrentHashMap<>();

    public InMemoryViewStateRepository(Function<? super E, ? extends K> eventKey,
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
    public Optional<S> fetchState(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return Optional.ofNullable(states.get(eventKey.apply(event)));
    }

    @Override
    public S save(S state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        states.put(stateKey.apply(state), state);
        return state;
    }

    public void clear() {
        states.clear();
    }
}
