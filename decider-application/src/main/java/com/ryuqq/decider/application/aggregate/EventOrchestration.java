package com.ryuqq.decider.application.aggregate;

import com.ryuqq.decider.application.support.Steps;
import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Event Sourcing Orchestration의 재귀 탐색.
 *
 * <p>Command를 decide한 뒤 각 Event를 Saga에 전달하고, 만들어진 Command를 깊이 우선,
 * 왼쪽에서 오른쪽 순서로 처리합니다. 반환 목록은 Event가 만들어진 순서가 아니라 탐색 순서입니다:
 * 어떤 Event 바로 뒤에는 그 Event에서 파생된 모든 Event가 오고, 그 다음에 형제 Event가 옵니다.</p>
 *
 * <p>재귀 Command의 State는 {@code fold(fetchEvents(command) ++ 지금까지 decide된 Event)}입니다.
 * 아직 저장되지 않은 Event도 반영되므로 각 단계는 직전 단계의 결과를 봅니다.</p>
 *
 * @param <C> Command 타입
 * @param <S> State 타입
 * @param <E> Event 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
final class EventOrchestration<C, S, E> {

    private final Decider<C, S, E> decider;
    private final Saga<E, C> saga;
    private final Function<C, List<E>> fetchEvents;
    private final int maxDepth;

    EventOrchestration(Decider<C, S, E> decider, Saga<E, C> saga, Function<C, List<E>> fetchEvents, int maxDepth) {
        this.decider = decider;
        this.saga = saga;
        this.fetchEvents = fetchEvents;
        this.maxDepth = maxDepth;
    }

    /**
     * 초기 Command에서 시작하는 전체 탐색.
     *
     * @param command 초기 Command
     * @return 탐색 순서의 모든 새 Event, 한 단계라도 실패하면 해당 Failure
     */
    Outcome<List<E>> run(C command) {
        Traversal traversal = new Traversal();
        return traversal.visit(command, 0)
            .<Outcome<List<E>>>map(Outcome::fail)
            .orElseGet(() -> Outcome.ok(List.copyOf(traversal.emitted)));
    }

    private final class Traversal {

        private final List<E> decided = new ArrayList<>();
        private final List<E> emitted = new ArrayList<>();

        private Optional<Failure> visit(C command, int depth) {
            if (depth > maxDepth) {
                return Optional.of(new Failure.CalculationFailed(command, new SagaDepthExceededException(maxDepth, command)));
            }
            Outcome<List<E>> decision = Steps.fetch(command, () -> fetchEvents.apply(command))
                .flatMap(fetched -> Steps.fold(decider, command, decider.initialState(), concat(fetched, decided)))
                .flatMap(state -> Steps.decide(decider, command, state));
            if (decision.isFail()) {
                return Optional.of(decision.failureOrNull());
            }
            List<E> newEvents = decision.getOrThrow();
            decided.addAll(newEvents);

            for (E event : newEvents) {
                emitted.add(event);
                Outcome<List<C>> reaction = Steps.calculate(event, () -> saga.react(event).collect(Collectors.toList()));
                if (reaction.isFail()) {
                    return Optional.of(reaction.failureOrNull());
                }
                for (C next : reaction.getOrThrow()) {
                    Optional<Failure> failure = visit(next, depth + 1);
                    if (failure.isPresent()) {
                        return failure;
                    }
                }
            }
            return Optional.empty();
        }

        private List<E> concat(List<E> fetched, List<E> inFlight) {
            if (inFlight.isEmpty()) {
                return fetched;
            }
            List<E> all = new ArrayList<>(fetched.size() + inFlight.size());
            all.addAll(fetched);
            all.addAll(inFlight);
            return all;
        }
    }
}
