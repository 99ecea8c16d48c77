package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.StateLockingRepository;
import com.ryuqq.decider.core.spi.VersionConflictException;

import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory implementation of {@link StateLockingRepository} with optimistic locking.
 *
 * <p><strong>Version Rules:</strong></p>
 * <ul>
 *   <li>Expected version {@code null}: the state must not exist yet; it is created with version 1</li>
 *   <li>Otherwise the expected version must equal the stored one; the new version is one higher</li>
 *   <li>Any mismatch throws {@link VersionConflictException} and keeps the stored state</li>
 * </ul>
 *
 * @param <C> Command type
 * @param <S> State type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryLockingStateRepository<C, S, K> implements StateLockingRepository<C, S, Long> {

    private final Function<? super C, ? extends K> commandKey;
    private final Function<? super S, ? extends K> stateKey;
    private final VersionedStateStore<K, S> store = new VersionedStateStore<>(VersionedStateStore.SequenceRule.NONE);

    public InMemoryLockingStateRepository(Function<? super C, ? extends K> commandKey,
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
    public Optional<Versioned<S, Long>> fetchState(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return store.fetch(commandKey.apply(command));
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
