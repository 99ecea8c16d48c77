package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchDispatcher 유닛 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class BatchDispatcherTest {

    private final List<Integer> handled = new ArrayList<>();

    private final Function<Integer, Outcome<Integer>> doubling = value -> {
        handled.add(value);
        return value < 0
            ? Outcome.fail(new Failure.CalculationFailed(value, new IllegalArgumentException("negative")))
            : Outcome.ok(value * 2);
    };

    // ============================================================
    // 1. 입력별 독립 처리
    // ============================================================

    @Test
    void dispatch_입력_순서대로_Outcome_반환() {
        // given
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);

        // when
        List<Outcome<Integer>> outcomes = dispatcher.dispatch(List.of(1, 2, 3));

        // then
        assertThat(outcomes).containsExactly(Outcome.ok(2), Outcome.ok(4), Outcome.ok(6));
    }

    @Test
    void dispatch_하나가_실패해도_나머지는_계속_처리() {
        // given
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);

        // when
        List<Outcome<Integer>> outcomes = dispatcher.dispatch(List.of(1, -1, 3));

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).getOrThrow()).isEqualTo(2);
        assertThat(outcomes.get(1).failureOrNull()).isInstanceOf(Failure.CalculationFailed.class);
        assertThat(outcomes.get(2).getOrThrow()).isEqualTo(6);
        assertThat(handled).containsExactly(1, -1, 3);
    }

    @Test
    void dispatch_빈_입력이면_빈_목록() {
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);

        assertThat(dispatcher.dispatch(List.of())).isEmpty();
        assertThat(handled).isEmpty();
    }

    // ============================================================
    // 2. 입력 소스 실패
    // ============================================================

    @Test
    void dispatch_입력_소스가_실패하면_PublishingFailed를_추가하고_중단() {
        // given
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);
        IllegalStateException broken = new IllegalStateException("cursor closed");
        Iterable<Integer> source = () -> new Iterator<>() {
            private int next = 1;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Integer next() {
                if (next > 2) {
                    throw broken;
                }
                return next++;
            }
        };

        // when
        List<Outcome<Integer>> outcomes = dispatcher.dispatch(source);

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).getOrThrow()).isEqualTo(2);
        assertThat(outcomes.get(1).getOrThrow()).isEqualTo(4);
        assertThat(outcomes.get(2).failureOrNull()).isEqualTo(new Failure.PublishingFailed(broken));
    }

    @Test
    void dispatch_iterator_생성이_실패해도_PublishingFailed() {
        // given
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);
        Iterable<Integer> source = () -> {
            throw new IllegalStateException("no connection");
        };

        // when
        List<Outcome<Integer>> outcomes = dispatcher.dispatch(source);

        // then
        assertThat(outcomes).hasSize(1);
        assertThat(outcomes.get(0).failureOrNull()).isInstanceOf(Failure.PublishingFailed.class);
        assertThat(handled).isEmpty();
    }

    // ============================================================
    // 3. 처리 함수 예외와 입력 검증
    // ============================================================

    @Test
    void dispatch_처리_함수_예외는_그_입력만_PublishingFailed_나머지는_계속_처리() {
        // given
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", value -> {
            if (value == null) {
                throw new IllegalArgumentException("command cannot be null");
            }
            return doubling.apply(value);
        });

        // when
        List<Outcome<Integer>> outcomes = dispatcher.dispatch(Arrays.asList(1, null, 3));

        // then
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).getOrThrow()).isEqualTo(2);
        assertThat(outcomes.get(1).failureOrNull()).isInstanceOf(Failure.PublishingFailed.class);
        assertThat(outcomes.get(1).failureOrNull().cause()).hasMessage("command cannot be null");
        assertThat(outcomes.get(2).getOrThrow()).isEqualTo(6);
        assertThat(handled).containsExactly(1, 3);
    }

    @Test
    void dispatch_null_입력이면_예외() {
        BatchDispatcher<Integer, Integer> dispatcher = new BatchDispatcher<>("numbers", doubling);

        assertThatThrownBy(() -> dispatcher.dispatch(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 생성자_null_이름이면_예외() {
        assertThatThrownBy(() -> new BatchDispatcher<>(null, doubling))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("name cannot be null");
    }
}
