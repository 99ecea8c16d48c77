/**
 * In-memory event stores for event-sourced aggregates.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.event.InMemoryEventRepository}: append-only streams</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.event.InMemoryLockingEventRepository}:
 *       streams versioned 1..n with optimistic locking</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.event.InMemorySnapshottingEventRepository}:
 *       streams that serve only the events after a snapshot</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
package com.ryuqq.decider.adapter.inmemory.event;
