/**
 * Saga execution.
 *
 * <p>{@link com.ryuqq.decider.application.saga.SagaManager} reacts to an action result and publishes
 * the resulting actions in order through an {@link com.ryuqq.decider.core.spi.ActionPublisher}.
 * A failing reaction is a {@code CalculationFailed}; a failing publish is a {@code StoreFailed}.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.saga;
