package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.DuplicateSequenceException;
import com.ryuqq.decider.core.spi.StateLockingDeduplicationRepository;

import java.util.Optional;
import java.util.function.Function;

/**
 * In-memory implementation of {@link StateLockingDeduplicationRepository}.
 *
 * <p>Adds command deduplication on top of {@link InMemoryLockingStateRepository}'s version rules:
 * a command sequence is accepted only when it is exactly the last accepted sequence of the same
 * state plus one, and the first is 1. A redelivered or skipped command fails with
 * {@link DuplicateSequenceException}.</p>
 *
 * @param <C> Command type
 * @param <S> State type
 * @param <K> Key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryDeduplicatingStateRepository<C, S, K>
    implements StateLockingDeduplicationRepository<C, S, Long, Long> {

    private final Function<? super C, ? extends K> commandKey;
    private final Function<? super S, ? extends K> stateKey;
    private final VersionedStateStore<K, S> store =
        new VersionedStateStore<>(VersionedStateStore.SequenceRule.CONSECUTIVE);

    public InMemoryDeduplicatingStateRepository(Function<? super C, ? extends K> commandKey,
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
    public Versioned<S, Long> save(S state, Long commandSequence, Long expectedVersion) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return store.save(stateKey.apply(state), state, commandSequence, expectedVersion);
    }

    public void clear() {
        store.clear();
    }
}
