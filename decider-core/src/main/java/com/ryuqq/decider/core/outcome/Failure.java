package com.ryuqq.decider.core.outcome;

/**
 * 실패 원인.
 *
 * <p>엔진의 각 단계는 하나의 Failure 종류에 대응합니다:</p>
 * <ul>
 *   <li>{@link FetchFailed}: 저장소 조회 실패</li>
 *   <li>{@link CalculationFailed}: decide, evolve, react 중 예외</li>
 *   <li>{@link StoreFailed}: 저장 실패 (거부, Version 충돌, 중복 Sequence)</li>
 *   <li>{@link TerminalStateReached}: terminal State에 Command 도착</li>
 *   <li>{@link PublishingFailed}: 배치 입력을 더 이상 읽을 수 없음</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface Failure
    permits Failure.FetchFailed, Failure.CalculationFailed, Failure.StoreFailed,
            Failure.TerminalStateReached, Failure.PublishingFailed {

    /**
     * 실패 종류.
     *
     * @return 실패 종류
     */
    FailureKind kind();

    /**
     * 원인 예외.
     *
     * @return 원인 예외 (없으면 null)
     */
    Throwable cause();

    /**
     * 로그와 예외 메시지용 요약.
     *
     * @return 실패 요약 문자열
     */
    default String describe() {
        Throwable cause = cause();
        return cause == null ? kind().name() : kind().name() + ": " + cause;
    }

    /**
     * 조회 실패.
     *
     * @param input 조회에 사용된 Command, Event 또는 Query
     * @param cause 원인 예외
     */
    record FetchFailed(Object input, Throwable cause) implements Failure {

        public FetchFailed {
            if (input == null) {
                throw new IllegalArgumentException("input cannot be null");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        @Override
        public FailureKind kind() {
            return FailureKind.FETCH_FAILED;
        }
    }

    /**
     * 계산 실패.
     *
     * @param input 계산 중이던 Command, Event 또는 Action Result
     * @param cause 원인 예외
     */
    record CalculationFailed(Object input, Throwable cause) implements Failure {

        public CalculationFailed {
            if (input == null) {
                throw new IllegalArgumentException("input cannot be null");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        @Override
        public FailureKind kind() {
            return FailureKind.CALCULATION_FAILED;
        }
    }

    /**
     * 저장 실패.
     *
     * @param reason 세부 사유
     * @param payload 저장하려던 Event 목록, State 또는 Action
     * @param cause 원인 예외
     */
    record StoreFailed(StoreFailureReason reason, Object payload, Throwable cause) implements Failure {

        public StoreFailed {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
            if (payload == null) {
                throw new IllegalArgumentException("payload cannot be null");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        @Override
        public FailureKind kind() {
            return FailureKind.STORE_FAILED;
        }

        /**
         * 다시 조회하고 다시 decide하면 성공할 수 있는 실패인지 확인.
         *
         * @return Version 충돌 여부
         */
        public boolean isVersionConflict() {
            return reason == StoreFailureReason.VERSION_CONFLICT;
        }

        @Override
        public String describe() {
            return kind().name() + "(" + reason + "): " + cause;
        }
    }

    /**
     * terminal State에 Command가 도착함.
     *
     * @param state terminal State
     * @param command 거부된 Command
     */
    record TerminalStateReached(Object state, Object command) implements Failure {

        public TerminalStateReached {
            if (state == null) {
                throw new IllegalArgumentException("state cannot be null");
            }
            if (command == null) {
                throw new IllegalArgumentException("command cannot be null");
            }
        }

        @Override
        public FailureKind kind() {
            return FailureKind.TERMINAL_STATE_REACHED;
        }

        @Override
        public Throwable cause() {
            return null;
        }
    }

    /**
     * 배치 입력 읽기 실패.
     *
     * @param cause 원인 예외
     */
    record PublishingFailed(Throwable cause) implements Failure {

        public PublishingFailed {
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }

        @Override
        public FailureKind kind() {
            return FailureKind.PUBLISHING_FAILED;
        }
    }
}
