package com.ryuqq.decider.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Version 충돌 재시도 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>같은 State를 두고 경쟁하는 writer들이 동시에 다시 부딪히지 않도록
 * 재시도 간격을 지수적으로 늘리고 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(retry-1), maxDelay)
 * delay       = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=50ms, maxDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>retry=1: 50-55ms</li>
 *   <li>retry=2: 100-110ms</li>
 *   <li>retry=6: 1000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 재시도 설정으로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        this(requireConfig(config).baseDelayMs(), config.maxDelayMs(), config.jitterFactor(),
            () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급원을 지정하여 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위의 난수 공급원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param retry 재시도 순번 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retry가 양수가 아닌 경우
     */
    public long calculate(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException(
                "retry must be positive (current: " + retry + ")"
            );
        }

        // 62 이상 shift하면 overflow
        int shift = Math.min(retry - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    private static RetryConfig requireConfig(RetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
