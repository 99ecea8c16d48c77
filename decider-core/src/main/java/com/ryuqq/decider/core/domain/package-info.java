/**
 * Pure state machines and their composition algebra.
 *
 * <h2>Machines</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.domain.Decider} - (command, state) to events, (state, event) to state</li>
 *   <li>{@link com.ryuqq.decider.core.domain.View} - (state, event) to state projection</li>
 *   <li>{@link com.ryuqq.decider.core.domain.Saga} - action result to follow-up actions</li>
 * </ul>
 *
 * <h2>Composition</h2>
 * <ul>
 *   <li><strong>Adapters:</strong> {@code mapLeftOnCommand}, {@code dimapOnEvent}, {@code dimapOnState},
 *       {@code mapLeftOnEvent}, {@code mapLeftOnActionResult}, {@code mapOnAction}</li>
 *   <li><strong>Product on state:</strong> {@code productOnState} runs two machines over the same inputs</li>
 *   <li><strong>Combine:</strong> two independent machines become one machine over
 *       {@link com.ryuqq.decider.core.model.Either} inputs and {@link com.ryuqq.decider.core.model.Pair} state</li>
 *   <li><strong>Identity:</strong> {@code empty} machines leave the other side of a combination untouched</li>
 * </ul>
 *
 * <p>Nothing in this package performs I/O, owns threads, or holds mutable state.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.domain;
