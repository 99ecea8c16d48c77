package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.spi.StateRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link StateRepository}.
 *
 * <p>The last saved state wins; there is no conflict detection. Use
 * {@link InMemoryLockingStateRepository} when concurrent writers must be detected.</p>
 *
 * @param <C> Command type
 * @param <S> State type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryStateRepository<C, S, K> implements StateRepository<C, S> {

    private final Function<? super C, ? extends K> commandKey;
    private final Function<? super S, ? extends K> stateKey;
    private final ConcurrentHashMap<K, S> states = new ConcurrentHashMap<>();

    /**
     * Creates an empty repository.
     *
     * @param commandKey resolves the state a command reads
     * @param stateKey resolves the slot a state is written to
     * @throws IllegalArgumentException if either extractor is null
     */
    public InMemoryStateRepository(Function<? super C, ? extends K> commandKey,
                                   Function<? super S, ? extends K> stateKey) {
        if (commandKey == null) {
            throw new IllegalArgumentException("commandKey cannot be null");
        }
        if (stateKey == null) {
            throw new IllegalArgumentException("stateKey cannot be null");
        }
        this.commandKey = commandKey;
        this.stateKey = stateKey;
    }

    @Override
    public Optional<S> fetchState(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return Optional.ofNullable(states.get(commandKey.apply(command)));
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
