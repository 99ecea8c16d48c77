/**
 * Step guards shared by the execution engines.
 *
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.support.Steps} - Turns exceptions of one pipeline step into its typed failure</li>
 *   <li>{@link com.ryuqq.decider.application.support.Batches} - One outcome per batch item</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.support;
