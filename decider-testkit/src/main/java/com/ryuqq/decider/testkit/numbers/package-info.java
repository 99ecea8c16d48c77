/**
 * Even/odd numbers sample domain used by the contract tests and the engine tests.
 *
 * <h2>Entry Points</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.testkit.numbers.Numbers#numberDecider()} - even and odd deciders combined</li>
 *   <li>{@link com.ryuqq.decider.testkit.numbers.Numbers#numberSaga()} - even number {@code n} added
 *       triggers adding odd number {@code n - 1}</li>
 *   <li>{@link com.ryuqq.decider.testkit.numbers.Numbers#numberView()} - even and odd views combined</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.testkit.numbers;
