package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.outcome.StoreFailureReason;
import com.ryuqq.decider.core.spi.EventLockingRepository;
import com.ryuqq.decider.core.spi.VersionConflictException;
import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberAdded;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import com.ryuqq.decider.testkit.numbers.Numbers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * EventSourcingLockingAggregate 유닛 테스트.
 *
 * <p>마지막으로 조회된 Event의 Version이 저장 시 기대 Version으로 전달되는지 검증합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EventSourcingLockingAggregateTest {

    private static final EvenNumberCommand COMMAND = new AddEvenNumber(4);

    @Mock
    private EventLockingRepository<EvenNumberCommand, EvenNumberEvent, Long> repository;

    private EventSourcingLockingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent, Long> aggregate;

    @BeforeEach
    void setUp() {
        aggregate = new EventSourcingLockingAggregate<>(Numbers.evenNumberDecider(), repository);
    }

    @Test
    void handleOptimistically_빈_스트림은_null_Version으로_저장() {
        // given
        List<EvenNumberEvent> expected = List.of(new EvenNumberAdded(4));
        when(repository.fetchEvents(COMMAND)).thenReturn(List.of());
        when(repository.save(expected, (Long) null)).thenReturn(List.of(Versioned.of(new EvenNumberAdded(4), 1L)));

        // when
        Outcome<List<Versioned<EvenNumberEvent, Long>>> outcome = aggregate.handleOptimistically(COMMAND);

        // then
        assertThat(outcome.getOrThrow()).containsExactly(Versioned.of(new EvenNumberAdded(4), 1L));
    }

    @Test
    void handleOptimistically_마지막_Event의_Version을_기대_Version으로_사용() {
        // given
        when(repository.fetchEvents(COMMAND)).thenReturn(List.of(
            Versioned.of(new EvenNumberAdded(2), 1L),
            Versioned.of(new EvenNumberAdded(2), 2L)
        ));
        when(repository.save(anyList(), eq(2L))).thenReturn(List.of(Versioned.of(new EvenNumberAdded(4), 3L)));

        // when
        Outcome<List<Versioned<EvenNumberEvent, Long>>> outcome = aggregate.handleOptimistically(COMMAND);

        // then
        assertThat(outcome.getOrThrow()).extracting(Versioned::version).containsExactly(3L);
        verify(repository).save(List.of(new EvenNumberAdded(4)), 2L);
    }

    @Test
    void handleOptimistically_Version_충돌은_StoreFailed_VERSION_CONFLICT() {
        // given
        VersionConflictException conflict = new VersionConflictException(2L, 3L);
        when(repository.fetchEvents(COMMAND)).thenReturn(List.of(Versioned.of(new EvenNumberAdded(2), 2L)));
        when(repository.save(anyList(), eq(2L))).thenThrow(conflict);

        // when
        Outcome<List<Versioned<EvenNumberEvent, Long>>> outcome = aggregate.handleOptimistically(COMMAND);

        // then
        Failure.StoreFailed failure = (Failure.StoreFailed) outcome.failureOrNull();
        assertThat(failure.reason()).isEqualTo(StoreFailureReason.VERSION_CONFLICT);
        assertThat(failure.isVersionConflict()).isTrue();
        assertThat(failure.cause()).isSameAs(conflict);
    }

    @Test
    void handleOptimistically_결정된_Event가_없으면_저장하지_않음() {
        // given
        EventSourcingLockingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent, Long> silent =
            new EventSourcingLockingAggregate<>(
                Decider.empty(EvenNumberState.INITIAL), repository);
        when(repository.fetchEvents(COMMAND)).thenReturn(List.of());

        // when
        Outcome<List<Versioned<EvenNumberEvent, Long>>> outcome = silent.handleOptimistically(COMMAND);

        // then
        assertThat(outcome.getOrThrow()).isEmpty();
        verify(repository, never()).save(anyList(), any(Long.class));
    }

    @Test
    void handleAllOptimistically_Command별_Outcome() {
        // given
        when(repository.fetchEvents(any())).thenReturn(List.of());
        when(repository.save(anyList(), (Long) isNull())).thenAnswer(invocation -> {
            List<EvenNumberEvent> events = invocation.getArgument(0);
            return List.of(Versioned.of(events.get(0), 1L));
        });

        // when
        List<Outcome<List<Versioned<EvenNumberEvent, Long>>>> outcomes = aggregate.handleAllOptimistically(
            List.of(new AddEvenNumber(2), new AddEvenNumber(4000), new AddEvenNumber(6)));

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).isOk()).isTrue();
        assertThat(outcomes.get(1).failureOrNull()).isInstanceOf(Failure.CalculationFailed.class);
        assertThat(outcomes.get(2).getOrThrow()).containsExactly(Versioned.of(new EvenNumberAdded(6), 1L));
    }
}
