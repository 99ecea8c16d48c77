/**
 * Engine configuration.
 *
 * <h2>Configuration Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.application.config.OrchestrationConfig} - Saga recursion bound</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.config;
