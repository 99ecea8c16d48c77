package com.ryuqq.decider.application.aggregate;

/**
 * Saga가 만든 Command의 재귀 깊이가 설정된 최대값을 넘었음을 나타냅니다.
 *
 * <p>엔진은 이 예외를 던지지 않고 CalculationFailed의 원인으로 담아 반환합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class SagaDepthExceededException extends RuntimeException {

    private final int maxDepth;

    /**
     * 생성자.
     *
     * @param maxDepth 설정된 최대 깊이
     * @param command 최대 깊이를 넘은 Command
     */
    public SagaDepthExceededException(int maxDepth, Object command) {
        super("Saga recursion exceeded max depth " + maxDepth + " at command " + command);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
