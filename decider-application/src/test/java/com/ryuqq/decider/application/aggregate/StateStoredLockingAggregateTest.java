package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.core.model.Pair;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.outcome.StoreFailureReason;
import com.ryuqq.decider.core.spi.DuplicateSequenceException;
import com.ryuqq.decider.core.spi.StateLockingDeduplicationRepository;
import com.ryuqq.decider.core.spi.StateLockingRepository;
import com.ryuqq.decider.core.spi.VersionConflictException;
import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import com.ryuqq.decider.testkit.numbers.Numbers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * StateStoredLockingAggregate, StateStoredLockingDeduplicationAggregate 유닛 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StateStoredLockingAggregateTest {

    private static final EvenNumberCommand COMMAND = new AddEvenNumber(4);

    @Mock
    private StateLockingRepository<EvenNumberCommand, EvenNumberState, Long> lockingRepository;

    @Mock
    private StateLockingDeduplicationRepository<EvenNumberCommand, EvenNumberState, Long, Long> deduplicationRepository;

    // ============================================================
    // 1. Locking
    // ============================================================

    @Test
    void handleOptimistically_조회한_Version을_기대_Version으로_저장() {
        // given
        when(lockingRepository.fetchState(COMMAND)).thenReturn(Optional.of(Versioned.of(new EvenNumberState(2), 7L)));
        when(lockingRepository.save(new EvenNumberState(6), 7L)).thenReturn(Versioned.of(new EvenNumberState(6), 8L));

        // when
        Outcome<Versioned<EvenNumberState, Long>> outcome =
            new StateStoredLockingAggregate<>(Numbers.evenNumberDecider(), lockingRepository).handleOptimistically(COMMAND);

        // then
        assertThat(outcome.getOrThrow()).isEqualTo(Versioned.of(new EvenNumberState(6), 8L));
    }

    @Test
    void handleOptimistically_State가_없으면_null_Version으로_생성() {
        // given
        when(lockingRepository.fetchState(COMMAND)).thenReturn(Optional.empty());
        when(lockingRepository.save(new EvenNumberState(4), null)).thenReturn(Versioned.of(new EvenNumberState(4), 1L));

        // when
        Outcome<Versioned<EvenNumberState, Long>> outcome =
            new StateStoredLockingAggregate<>(Numbers.evenNumberDecider(), lockingRepository).handleOptimistically(COMMAND);

        // then
        assertThat(outcome.getOrThrow().version()).isEqualTo(1L);
    }

    @Test
    void handleOptimistically_Version_충돌은_StoreFailed_VERSION_CONFLICT() {
        // given
        when(lockingRepository.fetchState(COMMAND)).thenReturn(Optional.of(Versioned.of(new EvenNumberState(2), 7L)));
        when(lockingRepository.save(new EvenNumberState(6), 7L)).thenThrow(new VersionConflictException(7L, 9L));

        // when
        Outcome<Versioned<EvenNumberState, Long>> outcome =
            new StateStoredLockingAggregate<>(Numbers.evenNumberDecider(), lockingRepository).handleOptimistically(COMMAND);

        // then
        Failure.StoreFailed failure = (Failure.StoreFailed) outcome.failureOrNull();
        assertThat(failure.reason()).isEqualTo(StoreFailureReason.VERSION_CONFLICT);
        assertThat(failure.payload()).isEqualTo(new EvenNumberState(6));
    }

    // ============================================================
    // 2. Locking + Deduplication
    // ============================================================

    @Test
    void handleOptimistically_Command_순번을_저장소에_전달() {
        // given
        when(deduplicationRepository.fetchState(COMMAND)).thenReturn(Optional.empty());
        when(deduplicationRepository.save(new EvenNumberState(4), 1L, null))
            .thenReturn(Versioned.of(new EvenNumberState(4), 1L));

        // when
        Outcome<Versioned<EvenNumberState, Long>> outcome =
            new StateStoredLockingDeduplicationAggregate<>(Numbers.evenNumberDecider(), deduplicationRepository)
                .handleOptimistically(COMMAND, 1L);

        // then
        assertThat(outcome.getOrThrow()).isEqualTo(Versioned.of(new EvenNumberState(4), 1L));
    }

    @Test
    void handleAllOptimistically_중복_순번은_StoreFailed_DUPLICATE_SEQUENCE() {
        // given
        when(deduplicationRepository.fetchState(COMMAND))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(Versioned.of(new EvenNumberState(4), 1L)));
        when(deduplicationRepository.save(new EvenNumberState(4), 1L, null))
            .thenReturn(Versioned.of(new EvenNumberState(4), 1L));
        when(deduplicationRepository.save(new EvenNumberState(8), 1L, 1L))
            .thenThrow(new DuplicateSequenceException(1L, 1L));
        StateStoredLockingDeduplicationAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent, Long, Long> aggregate =
            new StateStoredLockingDeduplicationAggregate<>(Numbers.evenNumberDecider(), deduplicationRepository);

        // when
        List<Outcome<Versioned<EvenNumberState, Long>>> outcomes = aggregate.handleAllOptimistically(List.of(
            Pair.of(COMMAND, 1L),
            Pair.of(COMMAND, 1L)
        ));

        // then
        assertThat(outcomes.get(0).isOk()).isTrue();
        assertThat(((Failure.StoreFailed) outcomes.get(1).failureOrNull()).reason())
            .isEqualTo(StoreFailureReason.DUPLICATE_SEQUENCE);
    }
}
