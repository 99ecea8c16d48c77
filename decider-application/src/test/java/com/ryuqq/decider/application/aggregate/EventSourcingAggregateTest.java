package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.fixture.RecordingEventRepository;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.outcome.Fail;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.FailureKind;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.core.outcome.StoreFailureReason;
import com.ryuqq.decider.core.spi.EventRepository;
import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberAdded;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import com.ryuqq.decider.testkit.numbers.Numbers;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * EventSourcingAggregate 유닛 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class EventSourcingAggregateTest {

    private final RecordingEventRepository<EvenNumberCommand, EvenNumberEvent> repository = new RecordingEventRepository<>();
    private final EventSourcingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent> aggregate =
        new EventSourcingAggregate<>(Numbers.evenNumberDecider(), repository);

    // ============================================================
    // 1. 정상 처리
    // ============================================================

    @Test
    void handle_Command_결정된_Event_저장_후_반환() {
        // when
        Outcome<List<EvenNumberEvent>> outcome = aggregate.handle(new AddEvenNumber(2));

        // then
        assertThat(outcome.getOrThrow()).containsExactly(new EvenNumberAdded(2));
        assertThat(repository.events()).containsExactly(new EvenNumberAdded(2));
    }

    @Test
    void handle_저장된_Event를_접은_State로_decide() {
        // given: State 값이 Event를 그대로 돌려주는 Decider
        Decider<EvenNumberCommand, EvenNumberState, EvenNumberEvent> echo = Decider.of(
            (c, s) -> Stream.of(new EvenNumberAdded(s.value() + c.value())),
            (s, e) -> new EvenNumberState(e.value()),
            EvenNumberState.INITIAL
        );
        repository.given(new EvenNumberAdded(2), new EvenNumberAdded(6));
        EventSourcingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent> stateful =
            new EventSourcingAggregate<>(echo, repository);

        // when
        Outcome<List<EvenNumberEvent>> outcome = stateful.handle(new AddEvenNumber(4));

        // then
        assertThat(outcome.getOrThrow()).containsExactly(new EvenNumberAdded(10));
    }

    // ============================================================
    // 2. 단계별 실패 변환
    // ============================================================

    @Test
    void handle_decide_예외는_CalculationFailed_저장하지_않음() {
        // when
        Outcome<List<EvenNumberEvent>> outcome = aggregate.handle(new AddEvenNumber(2000));

        // then
        assertThat(outcome.isFail()).isTrue();
        Failure failure = outcome.failureOrNull();
        assertThat(failure).isInstanceOf(Failure.CalculationFailed.class);
        assertThat(failure.cause()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(((Failure.CalculationFailed) failure).input()).isEqualTo(new AddEvenNumber(2000));
        assertThat(repository.events()).isEmpty();
    }

    @Test
    void handle_조회_예외는_FetchFailed() {
        // given
        @SuppressWarnings("unchecked")
        EventRepository<EvenNumberCommand, EvenNumberEvent> broken = mock(EventRepository.class);
        IllegalStateException boom = new IllegalStateException("connection refused");
        when(broken.fetchEvents(any())).thenThrow(boom);

        // when
        Outcome<List<EvenNumberEvent>> outcome =
            new EventSourcingAggregate<>(Numbers.evenNumberDecider(), broken).handle(new AddEvenNumber(2));

        // then
        assertThat(outcome.failureOrNull()).isEqualTo(new Failure.FetchFailed(new AddEvenNumber(2), boom));
        verify(broken, never()).save(anyList());
    }

    @Test
    void handle_저장_예외는_StoreFailed_REJECTED() {
        // given
        @SuppressWarnings("unchecked")
        EventRepository<EvenNumberCommand, EvenNumberEvent> broken = mock(EventRepository.class);
        when(broken.fetchEvents(any())).thenReturn(List.of());
        when(broken.save(anyList())).thenThrow(new IllegalStateException("disk full"));

        // when
        Outcome<List<EvenNumberEvent>> outcome =
            new EventSourcingAggregate<>(Numbers.evenNumberDecider(), broken).handle(new AddEvenNumber(2));

        // then
        Failure failure = outcome.failureOrNull();
        assertThat(failure.kind()).isEqualTo(FailureKind.STORE_FAILED);
        assertThat(((Failure.StoreFailed) failure).reason()).isEqualTo(StoreFailureReason.REJECTED);
        assertThat(((Failure.StoreFailed) failure).payload()).isEqualTo(List.of(new EvenNumberAdded(2)));
    }

    @Test
    void handle_terminal_State면_TerminalStateReached() {
        // given
        Decider<EvenNumberCommand, EvenNumberState, EvenNumberEvent> capped = Decider.of(
            Numbers.evenNumberDecider()::decide,
            Numbers.evenNumberDecider()::evolve,
            EvenNumberState.INITIAL,
            s -> s.value() >= 10
        );
        repository.given(new EvenNumberAdded(10));

        // when
        Outcome<List<EvenNumberEvent>> outcome =
            new EventSourcingAggregate<>(capped, repository).handle(new AddEvenNumber(2));

        // then
        assertThat(outcome.failureOrNull())
            .isEqualTo(new Failure.TerminalStateReached(new EvenNumberState(10), new AddEvenNumber(2)));
        assertThat(repository.events()).containsExactly(new EvenNumberAdded(10));
    }

    // ============================================================
    // 3. 배치
    // ============================================================

    @Test
    void handleAll_실패한_Command가_다음_Command를_막지_않음() {
        // when
        List<Outcome<List<EvenNumberEvent>>> outcomes = aggregate.handleAll(List.of(
            new AddEvenNumber(2), new AddEvenNumber(2000), new AddEvenNumber(4)));

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).isOk()).isTrue();
        assertThat(outcomes.get(1)).isInstanceOf(Fail.class);
        assertThat(outcomes.get(2).getOrThrow()).containsExactly(new EvenNumberAdded(4));
        assertThat(repository.events()).containsExactly(new EvenNumberAdded(2), new EvenNumberAdded(4));
    }

    @Test
    void handleAll_null_Command는_그_항목만_실패하고_다음_Command는_처리됨() {
        // when
        List<Outcome<List<EvenNumberEvent>>> outcomes = aggregate.handleAll(Arrays.asList(
            new AddEvenNumber(2), null, new AddEvenNumber(4)));

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).getOrThrow()).containsExactly(new EvenNumberAdded(2));
        assertThat(outcomes.get(1).failureOrNull())
            .isInstanceOf(Failure.PublishingFailed.class)
            .extracting(Failure::cause)
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(outcomes.get(2).getOrThrow()).containsExactly(new EvenNumberAdded(4));
        assertThat(repository.events()).containsExactly(new EvenNumberAdded(2), new EvenNumberAdded(4));
    }

    @Test
    void handleAll_입력_스트림_실패는_PublishingFailed로_종료() {
        // given
        RuntimeException broken = new IllegalStateException("upstream closed");
        Iterable<EvenNumberCommand> commands = () -> new Iterator<>() {
            private boolean first = true;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public EvenNumberCommand next() {
                if (first) {
                    first = false;
                    return new AddEvenNumber(2);
                }
                throw broken;
            }
        };

        // when
        List<Outcome<List<EvenNumberEvent>>> outcomes = aggregate.handleAll(commands);

        // then
        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).isOk()).isTrue();
        assertThat(outcomes.get(1).failureOrNull()).isEqualTo(new Failure.PublishingFailed(broken));
    }

    @Test
    void handleAll_빈_입력은_빈_결과() {
        assertThat(aggregate.handleAll(List.of())).isEmpty();
    }

    // ============================================================
    // 4. 입력 검증
    // ============================================================

    @Test
    void handle_null_Command는_IllegalArgumentException() {
        assertThatThrownBy(() -> aggregate.handle(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 생성자_null_의존성은_IllegalArgumentException() {
        assertThatThrownBy(() -> new EventSourcingAggregate<>(null, repository))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("decider cannot be null");
        assertThatThrownBy(() -> new EventSourcingAggregate<>(Numbers.evenNumberDecider(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("repository cannot be null");
    }

    @Test
    void handleAll_null_입력은_IllegalArgumentException() {
        assertThatThrownBy(() -> aggregate.handleAll(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
