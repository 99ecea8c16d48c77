/**
 * 엔진 바깥에서 동작하는 호스트 측 실행 도구.
 *
 * <p>Core와 Application은 로그를 남기지 않고 재시도하지 않습니다. 이 패키지는 그 위에서
 * 배치 처리, Version 충돌 재시도, 비동기 실행을 제공하며 SLF4J로 로그를 남깁니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.adapter.runner.BatchDispatcher}: 입력별 Outcome, 요약 로그</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.ConflictRetryingHandler}: Version 충돌 시 재시도</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.BackoffCalculator}: Exponential Backoff with Jitter</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.AsyncDispatcher}: 호출자 Executor에서 비동기 실행</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.RetryConfig}: 재시도 설정</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
package com.ryuqq.decider.adapter.runner;
