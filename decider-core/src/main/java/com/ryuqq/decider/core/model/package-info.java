/**
 * Value types shared by the state machines and the execution engines.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.model.Either} - Two-variant tagged union used to route commands, events and action results</li>
 *   <li>{@link com.ryuqq.decider.core.model.Pair} - Product of two states</li>
 *   <li>{@link com.ryuqq.decider.core.model.Versioned} - A value paired with its optimistic-locking version</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are records or sealed records</li>
 *   <li><strong>No null variants:</strong> Either never encodes an absent side as null</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.model;
