package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.DuplicateSequenceException;
import com.ryuqq.decider.core.spi.VersionConflictException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Versioned, optionally deduplicated state slots shared by the locking repositories.
 *
 * <p>Versions count 1..n per key. The sequence and version checks and the write run atomically
 * per key inside {@link ConcurrentHashMap#compute}; a rejected write leaves the slot untouched.</p>
 *
 * @param <K> key type
 * @param <S> state type
 */
final class VersionedStateStore<K, S> {

    /**
     * Acceptance rule for message sequences.
     */
    enum SequenceRule {
        /** Sequences are not tracked. */
        NONE,
        /** A sequence is accepted only when it is exactly the last accepted one plus one; the first is 1. */
        CONSECUTIVE
    }

    private record Slot<T>(Versioned<T, Long> state, Long lastSequence) {
    }

    private final SequenceRule rule;
    private final ConcurrentHashMap<K, Slot<S>> slots = new ConcurrentHashMap<>();

    VersionedStateStore(SequenceRule rule) {
        this.rule = rule;
    }

    Optional<Versioned<S, Long>> fetch(K key) {
        Slot<S> slot = slots.get(key);
        return slot == null ? Optional.empty() : Optional.of(slot.state());
    }

    Versioned<S, Long> save(K key, S state, Long sequence, Long expectedVersion) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (rule != SequenceRule.NONE && sequence == null) {
            throw new IllegalArgumentException("sequence cannot be null");
        }
        Slot<S> written = slots.compute(key, (k, slot) -> {
            Long lastSequence = slot == null ? null : slot.lastSequence();
            checkSequence(sequence, lastSequence);
            Long actualVersion = slot == null ? null : slot.state().version();
            if (!Objects.equals(actualVersion, expectedVersion)) {
                throw new VersionConflictException(expectedVersion, actualVersion);
            }
            long nextVersion = actualVersion == null ? 1L : actualVersion + 1;
            return new Slot<>(Versioned.of(state, nextVersion), rule == SequenceRule.NONE ? null : sequence);
        });
        return written.state();
    }

    void clear() {
        slots.clear();
    }

    private void checkSequence(Long sequence, Long lastSequence) {
        if (rule == SequenceRule.NONE) {
            return;
        }
        long last = lastSequence == null ? 0L : lastSequence;
        if (sequence != last + 1) {
            throw new DuplicateSequenceException(sequence, last);
        }
    }
}
