/**
 * View execution engines.
 *
 * <h2>Materialized</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.view.MaterializedView} - fetch, evolve, save</li>
 *   <li>{@link com.ryuqq.decider.application.view.MaterializedLockingView} - with optimistic locking</li>
 *   <li>{@link com.ryuqq.decider.application.view.MaterializedLockingDeduplicationView} - with locking and
 *       per-event sequence deduplication</li>
 * </ul>
 *
 * <h2>Ephemeral</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.view.EphemeralView} - fold the events of a query, persist nothing</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.view;
