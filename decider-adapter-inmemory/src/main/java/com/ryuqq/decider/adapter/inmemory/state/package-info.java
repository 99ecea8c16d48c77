/**
 * In-memory state repositories for state-stored aggregates and materialized views.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.state.InMemoryStateRepository} and
 *       {@link com.ryuqq.decider.adapter.inmemory.state.InMemoryViewStateRepository}: last write wins</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.state.InMemoryLockingStateRepository} and
 *       {@link com.ryuqq.decider.adapter.inmemory.state.InMemoryLockingViewStateRepository}:
 *       optimistic locking with versions 1..n</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.state.InMemoryDeduplicatingStateRepository}:
 *       locking plus consecutive command sequences</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.state.InMemoryDeduplicatingViewStateRepository}:
 *       locking plus consecutive event sequences</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Keys:</strong> caller-supplied extractors map commands, events and states to slots</li>
 *   <li><strong>Concurrency:</strong> checks and writes are atomic per key</li>
 *   <li><strong>Isolation:</strong> every repository is an explicitly created instance; nothing is static</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
package com.ryuqq.decider.adapter.inmemory.state;
