package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Version 충돌 시 재시도하는 Handler 래퍼.
 *
 * <p>엔진은 스스로 재시도하지 않습니다. 이 래퍼는 엔진의 {@code handleOptimistically} 같은
 * 처리 함수를 감싸, 결과가 {@code StoreFailed(VERSION_CONFLICT)}일 때만 처리 함수를 다시
 * 호출합니다. 처리 함수는 매번 State를 새로 조회하고 다시 decide하므로, 재시도는 최신 State 위에서
 * 이루어집니다.</p>
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ul>
 *   <li>Ok, 또는 Version 충돌이 아닌 Fail → 즉시 반환</li>
 *   <li>Version 충돌 → {@link BackoffCalculator} 간격만큼 대기 후 재시도</li>
 *   <li>{@link RetryConfig#maxAttempts()} 소진 → 마지막 충돌 Outcome 반환</li>
 *   <li>대기 중 인터럽트 → 인터럽트 플래그 복원 후 마지막 충돌 Outcome 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ConflictRetryingHandler&lt;OrderCommand, Versioned&lt;Order, Long&gt;&gt; handler =
 *     new ConflictRetryingHandler&lt;&gt;(aggregate::handleOptimistically, new RetryConfig());
 * Outcome&lt;Versioned&lt;Order, Long&gt;&gt; outcome = handler.handle(command);
 * </pre>
 *
 * @param <I> 입력 타입 (Command, Event 등)
 * @param <T> 결과 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class ConflictRetryingHandler<I, T> {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetryingHandler.class);

    /**
     * 재시도 전 대기 전략.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Function<? super I, Outcome<T>> handler;
    private final RetryConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    /**
     * 생성자.
     *
     * @param handler 감쌀 처리 함수
     * @param config 재시도 설정
     * @throws IllegalArgumentException handler 또는 config가 null인 경우
     */
    public ConflictRetryingHandler(Function<? super I, Outcome<T>> handler, RetryConfig config) {
        this(handler, config, Thread::sleep);
    }

    ConflictRetryingHandler(Function<? super I, Outcome<T>> handler, RetryConfig config, Sleeper sleeper) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.handler = handler;
        this.config = config;
        this.backoff = new BackoffCalculator(config);
        this.sleeper = sleeper;
    }

    /**
     * 입력 처리 (Version 충돌 시 재시도).
     *
     * @param input 처리할 입력
     * @return 최종 Outcome
     */
    public Outcome<T> handle(I input) {
        Outcome<T> outcome = handler.apply(input);
        int attempt = 1;
        while (isVersionConflict(outcome) && attempt < config.maxAttempts()) {
            long delay = backoff.calculate(attempt);
            log.debug("Version conflict on {} (attempt {}/{}), retrying in {}ms",
                input, attempt, config.maxAttempts(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry of {} interrupted after {} attempts", input, attempt);
                return outcome;
            }
            attempt++;
            outcome = handler.apply(input);
        }

        if (isVersionConflict(outcome)) {
            log.warn("Version conflict on {} persisted after {} attempts", input, attempt);
        } else if (attempt > 1) {
            log.info("{} resolved after {} attempts", input, attempt);
        }
        return outcome;
    }

    private static boolean isVersionConflict(Outcome<?> outcome) {
        Failure failure = outcome.failureOrNull();
        return failure instanceof Failure.StoreFailed && ((Failure.StoreFailed) failure).isVersionConflict();
    }
}
