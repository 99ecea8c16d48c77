/**
 * In-memory action publisher for saga managers.
 *
 * @author Decider Team
 * @since 1.0.0
 */
package com.ryuqq.decider.adapter.inmemory.saga;
