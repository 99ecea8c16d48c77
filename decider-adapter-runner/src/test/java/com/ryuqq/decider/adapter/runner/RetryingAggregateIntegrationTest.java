package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.adapter.inmemory.state.InMemoryLockingStateRepository;
import com.ryuqq.decider.application.aggregate.StateStoredLockingAggregate;
import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.outcome.Outcome;
import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberEvent;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import com.ryuqq.decider.testkit.numbers.Numbers;
import com.ryuqq.decider.testkit.numbers.SubtractEvenNumber;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runner 도구와 Aggregate, In-Memory 저장소를 함께 사용하는 통합 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class RetryingAggregateIntegrationTest {

    @Test
    void 동시_쓰기로_충돌한_Command는_재시도로_최신_상태_위에_저장됨() {
        // given: 처음 한 번은 조회 직후 다른 writer가 끼어듦
        InMemoryLockingStateRepository<EvenNumberCommand, EvenNumberState, String> repository =
            new InMemoryLockingStateRepository<>(c -> "even", s -> "even") {
                private boolean interleaved;

                @Override
                public Optional<Versioned<EvenNumberState, Long>> fetchState(EvenNumberCommand command) {
                    Optional<Versioned<EvenNumberState, Long>> read = super.fetchState(command);
                    if (!interleaved && read.isPresent()) {
                        interleaved = true;
                        save(new EvenNumberState(100), read.get().version());
                    }
                    return read;
                }
            };
        StateStoredLockingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent, Long> aggregate =
            new StateStoredLockingAggregate<>(Numbers.evenNumberDecider(), repository);
        List<Long> sleeps = new ArrayList<>();
        ConflictRetryingHandler<EvenNumberCommand, Versioned<EvenNumberState, Long>> retrying =
            new ConflictRetryingHandler<>(aggregate::handleOptimistically, new RetryConfig(3, 10, 100, 0.0), sleeps::add);
        aggregate.handleOptimistically(new AddEvenNumber(10));

        // when
        Outcome<Versioned<EvenNumberState, Long>> outcome = retrying.handle(new SubtractEvenNumber(2));

        // then
        assertThat(outcome.getOrThrow()).isEqualTo(Versioned.of(new EvenNumberState(98), 3L));
        assertThat(sleeps).containsExactly(10L);
        assertThat(repository.fetchState(new AddEvenNumber(2)))
            .contains(Versioned.of(new EvenNumberState(98), 3L));
    }

    @Test
    void BatchDispatcher로_Aggregate_배치_처리() {
        // given
        InMemoryLockingStateRepository<EvenNumberCommand, EvenNumberState, String> repository =
            new InMemoryLockingStateRepository<>(c -> "even", s -> "even");
        StateStoredLockingAggregate<EvenNumberCommand, EvenNumberState, EvenNumberEvent, Long> aggregate =
            new StateStoredLockingAggregate<>(Numbers.evenNumberDecider(), repository);
        BatchDispatcher<EvenNumberCommand, Versioned<EvenNumberState, Long>> dispatcher =
            new BatchDispatcher<>("even-numbers", aggregate::handleOptimistically);

        // when
        List<Outcome<Versioned<EvenNumberState, Long>>> outcomes = dispatcher.dispatch(List.of(
            new AddEvenNumber(2), new AddEvenNumber(2000), new AddEvenNumber(4)));

        // then
        assertThat(outcomes.get(0).getOrThrow()).isEqualTo(Versioned.of(new EvenNumberState(2), 1L));
        assertThat(outcomes.get(1).isFail()).isTrue();
        assertThat(outcomes.get(2).getOrThrow()).isEqualTo(Versioned.of(new EvenNumberState(6), 2L));
    }
}
