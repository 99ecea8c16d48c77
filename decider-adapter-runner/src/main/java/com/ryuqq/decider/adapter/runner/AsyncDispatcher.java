package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * 처리 함수를 호출자가 제공한 {@link Executor}에서 실행하는 Dispatcher.
 *
 * <p>이 클래스는 스레드 풀을 만들지 않습니다. 풀의 크기와 수명은 호출자가 관리합니다.
 * 예상된 실패는 {@code Outcome.Fail}로 정상 완료되며, Future가 예외로 완료되는 것은
 * 처리 함수 자체가 예외를 던진 경우(잘못된 입력 등)뿐입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutorService pool = Executors.newFixedThreadPool(4);
 * AsyncDispatcher&lt;OrderCommand, List&lt;OrderEvent&gt;&gt; dispatcher =
 *     new AsyncDispatcher&lt;&gt;(aggregate::handle, pool);
 * dispatcher.dispatch(command).thenAccept(outcome -&gt; ...);
 * </pre>
 *
 * @param <I> 입력 타입
 * @param <T> 결과 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class AsyncDispatcher<I, T> {

    private static final Logger log = LoggerFactory.getLogger(AsyncDispatcher.class);

    private final Function<? super I, Outcome<T>> handler;
    private final Executor executor;

    /**
     * 생성자.
     *
     * @param handler 입력별 처리 함수
     * @param executor 처리 함수를 실행할 Executor
     * @throws IllegalArgumentException handler 또는 executor가 null인 경우
     */
    public AsyncDispatcher(Function<? super I, Outcome<T>> handler, Executor executor) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.handler = handler;
        this.executor = executor;
    }

    /**
     * 단일 입력 비동기 처리.
     *
     * @param input 처리할 입력
     * @return 처리 결과 Future
     */
    public CompletableFuture<Outcome<T>> dispatch(I input) {
        return CompletableFuture.<Outcome<T>>supplyAsync(() -> handler.apply(input), executor)
            .whenComplete((outcome, error) -> {
                if (error != null) {
                    log.error("Async handling of {} failed", input, error);
                }
            });
    }

    /**
     * 여러 입력을 각각 비동기 처리하고 입력 순서대로 모음.
     *
     * @param inputs 입력 시퀀스
     * @return 입력 순서대로의 Outcome 목록 Future
     * @throws IllegalArgumentException inputs가 null인 경우
     */
    public CompletableFuture<List<Outcome<T>>> dispatchAll(Iterable<? extends I> inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        List<CompletableFuture<Outcome<T>>> futures = new ArrayList<>();
        for (I input : inputs) {
            futures.add(dispatch(input));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<Outcome<T>> outcomes = new ArrayList<>(futures.size());
                for (CompletableFuture<Outcome<T>> future : futures) {
                    outcomes.add(future.join());
                }
                return outcomes;
            });
    }
}
