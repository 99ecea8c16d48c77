package com.ryuqq.decider.adapter.inmemory.state;

import com.ryuqq.decider.core.model.Versioned;
import com.ryuqq.decider.core.spi.StateLockingRepository;
import com.ryuqq.decider.testkit.contract.AbstractStateLockingRepositoryContractTest;
import com.ryuqq.decider.testkit.numbers.AddEvenNumber;
import com.ryuqq.decider.testkit.numbers.EvenNumberCommand;
import com.ryuqq.decider.testkit.numbers.EvenNumberState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract tests for {@link InMemoryLockingStateRepository}.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class InMemoryLockingStateRepositoryTest extends AbstractStateLockingRepositoryContractTest {

    @Override
    protected StateLockingRepository<EvenNumberCommand, EvenNumberState, Long> createRepository() {
        return new InMemoryLockingStateRepository<>(c -> "even", s -> "even");
    }

    @Test
    void save_VersionsStartAtOneAndIncrease() {
        // when
        Versioned<EvenNumberState, Long> first = repository.save(new EvenNumberState(2), null);
        Versioned<EvenNumberState, Long> second = repository.save(new EvenNumberState(4), first.version());

        // then
        assertThat(first.version()).isEqualTo(1L);
        assertThat(second.version()).isEqualTo(2L);
    }

    @Test
    void clear_ForgetsStateAndVersion() {
        // given
        InMemoryLockingStateRepository<EvenNumberCommand, EvenNumberState, String> local =
            new InMemoryLockingStateRepository<>(c -> "even", s -> "even");
        local.save(new EvenNumberState(2), null);

        // when
        local.clear();

        // then
        assertThat(local.fetchState(new AddEvenNumber(2))).isEmpty();
        assertThat(local.save(new EvenNumberState(4), null).version()).isEqualTo(1L);
    }
}
