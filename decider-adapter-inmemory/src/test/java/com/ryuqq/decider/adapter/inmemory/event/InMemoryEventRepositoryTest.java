package com.ryuqq.decider.adapter.inmemory.event;

import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberAdded;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import com.ryuqq.decider.testkit.numbers.EvenNumberSubtracted;
import com.ryuqq.decider.testkit.numbers.SubtractEvenNumber;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryEventRepository} and {@link InMemorySnapshottingEventRepository}.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class InMemoryEventRepositoryTest {

    private static String commandKey(EvenNumberCommand command) {
        return command instanceof AddEvenNumber ? "added" : "subtracted";
    }

    private static String eventKey(EvenNumberEvent event) {
        return event instanceof EvenNumberAdded ? "added" : "subtracted";
    }

    @Test
    void fetchEvents_ReturnsOnlyTheCommandsStreamInAppendOrder() {
        // given
        InMemoryEventRepository<EvenNumberCommand, EvenNumberEvent, String> repository =
            new InMemoryEventRepository<>(InMemoryEventRepositoryTest::commandKey, InMemoryEventRepositoryTest::eventKey);
        repository.save(List.of(new EvenNumberAdded(2), new EvenNumberSubtracted(4), new EvenNumberAdded(6)));

        // when
        List<EvenNumberEvent> added = repository.fetchEvents(new AddEvenNumber(8));
        List<EvenNumberEvent> subtracted = repository.fetchEvents(new SubtractEvenNumber(8));

        // then
        assertThat(added).containsExactly(new EvenNumberAdded(2), new EvenNumberAdded(6));
        assertThat(subtracted).containsExactly(new EvenNumberSubtracted(4));
    }

    @Test
    void fetchEvents_ReturnsDetachedCopy() {
        // given
        InMemoryEventRepository<EvenNumberCommand, EvenNumberEvent, String> repository =
            new InMemoryEventRepository<>(c -> "even", e -> "even");
        List<EvenNumberEvent> before = repository.fetchEvents(new AddEvenNumber(2));

        // when
        repository.save(new EvenNumberAdded(2));

        // then
        assertThat(before).isEmpty();
        assertThat(repository.fetchEvents(new AddEvenNumber(2))).hasSize(1);
    }

    @Test
    void constructor_NullExtractor_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new InMemoryEventRepository<EvenNumberCommand, EvenNumberEvent, String>(null, e -> "even"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("commandKey cannot be null");
    }

    @Test
    void snapshotting_ServesOnlyEventsAfterAnnouncedSnapshot() {
        // given
        InMemorySnapshottingEventRepository<EvenNumberCommand, EvenNumberState, EvenNumberEvent, String> repository =
            new InMemorySnapshottingEventRepository<>(c -> "even", e -> "even", s -> "even", 2);
        repository.save(List.of(new EvenNumberAdded(2), new EvenNumberAdded(4)));

        // when
        boolean create = repository.shouldCreateNewSnapshot(null, new EvenNumberState(6));
        repository.save(new EvenNumberAdded(8));

        // then
        assertThat(create).isTrue();
        assertThat(repository.fetchEvents(new AddEvenNumber(2), new EvenNumberState(6)))
            .containsExactly(new EvenNumberAdded(8));
        assertThat(repository.fetchEvents(new AddEvenNumber(2), null)).hasSize(3);
    }

    @Test
    void snapshotting_DeclinesUntilIntervalReached() {
        // given
        InMemorySnapshottingEventRepository<EvenNumberCommand, EvenNumberState, EvenNumberEvent, String> repository =
            new InMemorySnapshottingEventRepository<>(c -> "even", e -> "even", s -> "even", 3);
        repository.save(List.of(new EvenNumberAdded(2), new EvenNumberAdded(4), new EvenNumberAdded(6)));
        repository.shouldCreateNewSnapshot(null, new EvenNumberState(12));
        repository.save(new EvenNumberAdded(8));

        // when & then
        assertThat(repository.shouldCreateNewSnapshot(new EvenNumberState(12), new EvenNumberState(20))).isFalse();
    }

    @Test
    void snapshotting_UnknownSnapshot_ThrowsIllegalStateException() {
        InMemorySnapshottingEventRepository<EvenNumberCommand, EvenNumberState, EvenNumberEvent, String> repository =
            new InMemorySnapshottingEventRepository<>(c -> "even", e -> "even", s -> "even", 2);

        assertThatThrownBy(() -> repository.fetchEvents(new AddEvenNumber(2), new EvenNumberState(42)))
            .isInstanceOf(IllegalStateException.class);
    }
}
