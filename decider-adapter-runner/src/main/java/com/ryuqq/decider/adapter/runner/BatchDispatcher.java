package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.FailureKind;
import com.ryuqq.decider.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 입력 배치를 처리 함수로 흘려보내는 Dispatcher.
 *
 * <p>입력마다 Outcome을 하나씩 만들고, 한 입력의 실패가 나머지 입력 처리를 막지 않습니다.
 * 입력 소스를 더 이상 읽을 수 없으면 {@link Failure.PublishingFailed}를 하나 추가하고 멈춥니다.
 * 처리 함수가 예외를 던진 입력은 그 입력만 {@link Failure.PublishingFailed}가 되고 다음 입력을 계속 처리합니다.
 * 배치가 끝나면 성공 건수와 실패 종류별 건수를 로그로 남깁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchDispatcher&lt;OrderEvent, OrderView&gt; dispatcher =
 *     new BatchDispatcher&lt;&gt;("order-view", view::handle);
 * List&lt;Outcome&lt;OrderView&gt;&gt; outcomes = dispatcher.dispatch(events);
 * </pre>
 *
 * @param <I> 입력 타입
 * @param <T> 결과 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class BatchDispatcher<I, T> {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final String name;
    private final Function<? super I, Outcome<T>> handler;

    /**
     * 생성자.
     *
     * @param name 로그에 표시할 배치 이름
     * @param handler 입력별 처리 함수
     * @throws IllegalArgumentException name 또는 handler가 null인 경우
     */
    public BatchDispatcher(String name, Function<? super I, Outcome<T>> handler) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.name = name;
        this.handler = handler;
    }

    /**
     * 배치 처리.
     *
     * @param inputs 입력 시퀀스
     * @return 입력 순서대로의 Outcome 목록
     * @throws IllegalArgumentException inputs가 null인 경우
     */
    public List<Outcome<T>> dispatch(Iterable<? extends I> inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        List<Outcome<T>> outcomes = new ArrayList<>();
        Iterator<? extends I> iterator = null;
        while (true) {
            I input;
            try {
                if (iterator == null) {
                    iterator = inputs.iterator();
                }
                if (!iterator.hasNext()) {
                    break;
                }
                input = iterator.next();
            } catch (RuntimeException e) {
                log.error("Batch {} stopped: input source failed after {} items", name, outcomes.size(), e);
                outcomes.add(Outcome.fail(new Failure.PublishingFailed(e)));
                break;
            }
            try {
                outcomes.add(handler.apply(input));
            } catch (RuntimeException e) {
                log.error("Batch {} rejected item {}: {}", name, outcomes.size(), input, e);
                outcomes.add(Outcome.fail(new Failure.PublishingFailed(e)));
            }
        }
        logSummary(outcomes);
        return outcomes;
    }

    private void logSummary(List<Outcome<T>> outcomes) {
        Map<FailureKind, Integer> failures = new EnumMap<>(FailureKind.class);
        int ok = 0;
        for (Outcome<T> outcome : outcomes) {
            Failure failure = outcome.failureOrNull();
            if (failure == null) {
                ok++;
            } else {
                failures.merge(failure.kind(), 1, Integer::sum);
            }
        }
        if (failures.isEmpty()) {
            log.info("Batch {} completed: {} ok", name, ok);
        } else {
            log.warn("Batch {} completed: {} ok, failures {}", name, ok, failures);
        }
    }
}
