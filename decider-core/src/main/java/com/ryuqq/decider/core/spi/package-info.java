/**
 * Service Provider Interfaces (SPI) for external collaborators.
 *
 * <p>The engines never touch storage or messaging directly. They talk to these interfaces,
 * which callers implement on top of a database, a broker, or the in-memory adapter.</p>
 *
 * <h2>Event Stores</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.spi.EventRepository} - Plain append and fetch</li>
 *   <li>{@link com.ryuqq.decider.core.spi.EventLockingRepository} - Versioned append with optimistic locking</li>
 *   <li>{@link com.ryuqq.decider.core.spi.EventSnapshottingRepository} - Fetch after a snapshot</li>
 * </ul>
 *
 * <h2>State Stores</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.spi.StateRepository} and its locking and deduplicating variants</li>
 *   <li>{@link com.ryuqq.decider.core.spi.ViewStateRepository} and its locking and deduplicating variants</li>
 *   <li>{@link com.ryuqq.decider.core.spi.EphemeralViewRepository} - Events for an on-demand projection</li>
 * </ul>
 *
 * <h2>Outbound</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.spi.ActionPublisher} - Publishes saga actions</li>
 * </ul>
 *
 * <h2>Conflict Signalling</h2>
 * <p>Repositories throw {@link com.ryuqq.decider.core.spi.VersionConflictException} or
 * {@link com.ryuqq.decider.core.spi.DuplicateSequenceException}. Engines translate them into
 * {@code StoreFailed} with the matching reason; any other exception becomes {@code REJECTED}.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.spi;
