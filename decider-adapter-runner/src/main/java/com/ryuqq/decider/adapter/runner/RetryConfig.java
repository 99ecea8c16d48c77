package com.ryuqq.decider.adapter.runner;

/**
 * Version 충돌 재시도 설정.
 *
 * <p>불변 객체로 설계되어 스레드 안전성을 보장합니다.
 * 설정 변경이 필요한 경우 {@code withXxx()} 메서드로 새 인스턴스를 생성합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxAttempts: 3 (최초 시도 포함)</li>
 *   <li>baseDelayMs: 50ms</li>
 *   <li>maxDelayMs: 1000ms</li>
 *   <li>jitterFactor: 0.1</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (최초 시도 포함, 양수)
 * @param baseDelayMs 첫 재시도 전 대기 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {

    /**
     * 기본 설정으로 생성.
     */
    public RetryConfig() {
        this(3, 50, 1000, 0.1);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
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
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, this.baseDelayMs, this.maxDelayMs, this.jitterFactor);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(this.maxAttempts, baseDelayMs, this.maxDelayMs, this.jitterFactor);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(this.maxAttempts, this.baseDelayMs, maxDelayMs, this.jitterFactor);
    }

    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(this.maxAttempts, this.baseDelayMs, this.maxDelayMs, jitterFactor);
    }
}
