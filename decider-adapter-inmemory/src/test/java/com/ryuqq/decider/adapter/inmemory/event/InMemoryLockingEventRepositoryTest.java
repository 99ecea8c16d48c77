package com.ryuqq.decider.adapter.inmemory.event;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.EventLockingRepository;
import com.ryuqq.decider.core.spi.VersionConflictException;
import com.ryuqq.decider.testkit.contract.AbstractEventLockingRepositoryContractTest;
import com.ryuqq.decider.testkit.numbers.EvenNumberAdded;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberSubtracted;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract tests for {@link InMemoryLockingEventRepository}, plus multi-stream behavior.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class InMemoryLockingEventRepositoryTest extends AbstractEventLockingRepositoryContractTest {

    @Override
    protected EventLockingRepository<EvenNumberCommand, EvenNumberEvent, Long> createRepository() {
        return new InMemoryLockingEventRepository<>(c -> "even", e -> "even");
    }

    @Test
    void save_EventsOfSeveralStreams_Rejected() {
        // given
        InMemoryLockingEventRepository<EvenNumberCommand, EvenNumberEvent, String> bySign =
            new InMemoryLockingEventRepository<>(c -> "added", e -> e instanceof EvenNumberAdded ? "added" : "subtracted");

        // when & then
        assertThatThrownBy(() -> bySign.save(List.of(new EvenNumberAdded(2), new EvenNumberSubtracted(2)), (Long) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void save_WithProvider_VersionsEachStreamIndependently() {
        // given
        InMemoryLockingEventRepository<EvenNumberCommand, EvenNumberEvent, String> bySign =
            new InMemoryLockingEventRepository<>(c -> "added", e -> e instanceof EvenNumberAdded ? "added" : "subtracted");

        // when
        List<Versioned<EvenNumberEvent, Long>> saved = bySign.save(
            List.of(new EvenNumberAdded(2), new EvenNumberSubtracted(2), new EvenNumberAdded(4)),
            bySign.latestVersionProvider());

        // then
        assertThat(saved).extracting(Versioned::version).containsExactly(1L, 1L, 2L);
        assertThat(bySign.streamOf("subtracted")).containsExactly(Versioned.of(new EvenNumberSubtracted(2), 1L));
    }

    @Test
    void save_WithStaleProvider_KeepsEventsAppendedBeforeConflict() {
        // given
        InMemoryLockingEventRepository<EvenNumberCommand, EvenNumberEvent, String> single =
            new InMemoryLockingEventRepository<>(c -> "even", e -> "even");

        // when & then
        assertThatThrownBy(() -> single.save(
            List.of(new EvenNumberAdded(2), new EvenNumberAdded(4)),
            event -> null))
            .isInstanceOf(VersionConflictException.class);
        assertThat(single.streamOf("even")).containsExactly(Versioned.of(new EvenNumberAdded(2), 1L));
    }

    @Test
    void clear_RemovesAllStreams() {
        // given
        InMemoryLockingEventRepository<EvenNumberCommand, EvenNumberEvent, String> single =
            new InMemoryLockingEventRepository<>(c -> "even", e -> "even");
        single.save(List.of(new EvenNumberAdded(2)), (Long) null);

        // when
        single.clear();

        // then
        assertThat(single.streamOf("even")).isEmpty();
        assertThat(single.latestVersionProvider().latestVersion(new EvenNumberAdded(2))).isNull();
    }
}
