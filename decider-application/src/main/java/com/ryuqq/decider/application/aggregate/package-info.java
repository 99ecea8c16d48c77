/**
 * Aggregate execution engines.
 *
 * <p>Every engine runs one pipeline per command: fetch, compute, save. Each step is guarded and
 * its failure returned as a typed {@link com.ryuqq.decider.core.outcome.Failure}; later steps do
 * not run. Nothing is retried and nothing is logged.</p>
 *
 * <h2>Event-Sourced</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.aggregate.EventSourcingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.EventSourcingLockingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.EventSourcingOrchestratingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.EventSourcingLockingOrchestratingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.EventSourcingSnapshottingAggregate}</li>
 * </ul>
 *
 * <h2>State-Stored</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.aggregate.StateStoredAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.StateStoredLockingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.StateStoredLockingDeduplicationAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.StateStoredOrchestratingAggregate}</li>
 *   <li>{@link com.ryuqq.decider.application.aggregate.StateStoredLockingOrchestratingAggregate}</li>
 * </ul>
 *
 * <h2>Orchestration Order</h2>
 * <pre>
 * command → [e1, e2]
 *   e1 → saga → [c1] → [e1a]
 *   e2 → saga → []
 * result: [e1, e1a, e2]
 * </pre>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.aggregate;
