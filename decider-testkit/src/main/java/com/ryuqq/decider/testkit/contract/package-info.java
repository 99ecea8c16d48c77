/**
 * Reusable JUnit 5 contract tests for repository implementations.
 *
 * <p>Adapters extend an abstract contract and supply a fresh repository; every inherited test then
 * runs against that implementation.</p>
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.testkit.contract.AbstractEventLockingRepositoryContractTest}</li>
 *   <li>{@link com.ryuqq.decider.testkit.contract.AbstractStateLockingRepositoryContractTest}</li>
 *   <li>{@link com.ryuqq.decider.testkit.contract.AbstractViewDeduplicationRepositoryContractTest}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * class InMemoryLockingEventRepositoryTest extends AbstractEventLockingRepositoryContractTest {
 *     {@literal @}Override
 *     protected EventLockingRepository&lt;EvenNumberCommand, EvenNumberEvent, Long&gt; createRepository() {
 *         return new InMemoryLockingEventRepository&lt;&gt;(c -&gt; "even", e -&gt; "even");
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.testkit.contract;
