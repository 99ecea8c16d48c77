package com.ryuqq.decider.application.config;

/**
 * Orchestrating Aggregate 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxDepth: Saga가 만든 Command를 재귀적으로 처리할 최대 깊이 (기본 64)</li>
 * </ul>
 *
 * <p>초기 Command의 깊이는 0이며, Saga가 만든 Command는 부모보다 1 깊습니다.
 * maxDepth를 넘는 Command가 생기면 Orchestration 전체가 CalculationFailed로 끝나고
 * 아무 Event도 저장되지 않습니다. Saga 사이에 순환이 생겨도 무한 재귀에 빠지지 않습니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 * @param maxDepth 최대 재귀 깊이 (양수여야 함)
 */
public record OrchestrationConfig(int maxDepth) {

    /** 기본 최대 재귀 깊이. */
    public static final int DEFAULT_MAX_DEPTH = 64;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxDepth=64</p>
     */
    public OrchestrationConfig() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxDepth가 양수가 아닌 경우
     */
    public OrchestrationConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException(
                "maxDepth must be positive (current: " + maxDepth + ")"
            );
        }
    }

    /**
     * maxDepth만 변경한 새 인스턴스 생성.
     *
     * @param maxDepth 새로운 최대 재귀 깊이
     * @return 새 OrchestrationConfig 인스턴스
     */
    public OrchestrationConfig withMaxDepth(int maxDepth) {
        return new OrchestrationConfig(maxDepth);
    }
}
