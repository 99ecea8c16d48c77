/**
 * Typed results of the execution engines.
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.outcome.Outcome} - permits {@link com.ryuqq.decider.core.outcome.Ok}
 *       and {@link com.ryuqq.decider.core.outcome.Fail}</li>
 *   <li>{@link com.ryuqq.decider.core.outcome.Failure} - one variant per engine step</li>
 * </ul>
 *
 * <h2>Failure Kinds</h2>
 * <ul>
 *   <li><strong>FETCH_FAILED:</strong> repository read threw</li>
 *   <li><strong>CALCULATION_FAILED:</strong> decide, evolve or react threw</li>
 *   <li><strong>STORE_FAILED:</strong> repository write or action publish threw,
 *       refined by {@link com.ryuqq.decider.core.outcome.StoreFailureReason}</li>
 *   <li><strong>TERMINAL_STATE_REACHED:</strong> command arrived at a terminal state</li>
 *   <li><strong>PUBLISHING_FAILED:</strong> a batch source could not be iterated</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Outcome&lt;List&lt;NumberEvent&gt;&gt; outcome = aggregate.handle(command);
 * if (outcome.isFail() &amp;&amp; outcome.failureOrNull() instanceof Failure.StoreFailed stored
 *         &amp;&amp; stored.isVersionConflict()) {
 *     // re-fetch and re-decide
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.outcome;
