package com.ryuqq.decider.adapter.inmemory.event;

import com.ryuqq.decider.core.spi.EventRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of {@link EventRepository} for testing and reference purposes.
 *
 * <p>Events are grouped into streams. The stream of a command and the stream of an event are
 * resolved by caller-supplied key extractors, so one repository instance can hold many aggregates.</p>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Each append runs inside {@link ConcurrentHashMap#compute}, which serializes writers per stream</li>
 *   <li>Readers get an immutable copy of the stream</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventRepository&lt;OrderCommand, OrderEvent, String&gt; repository =
 *     new InMemoryEventRepository&lt;&gt;(OrderCommand::orderId, OrderEvent::orderId);
 * EventSourcingAggregate&lt;OrderCommand, Order, OrderEvent&gt; aggregate =
 *     new EventSourcingAggregate&lt;&gt;(orderDecider, repository);
 * </pre>
 *
 * @param <C> Command type
 * @param <E> Event type
 * @param <K> Stream key type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryEventRepository<C, E, K> implements EventRepository<C, E> {

    private final Function<? super C, ? extends K> commandKey;
    private final Function<? super E, ? extends K> eventKey;
    private final ConcurrentHashMap<K, List<E>> streams = new ConcurrentHashMap<>();

    /**
     * Creates an empty repository.
     *
     * @param commandKey resolves the stream a command reads
     * @param eventKey resolves the stream an event is appended to
     * @throws IllegalArgumentException if either extractor is null
     */
    public InMemoryEventRepository(Function<? super C, ? extends K> commandKey,
                                   Function<? super E, ? extends K> eventKey) {
        if (commandKey == null) {
            throw new IllegalArgumentException("commandKey cannot be null");
        }
        if (eventKey == null) {
            throw new IllegalArgumentException("eventKey cannot be null");
        }
        this.commandKey = commandKey;
        this.eventKey = eventKey;
    }

    @Override
    public List<E> fetchEvents(C command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return streamOf(commandKey.apply(command));
    }

    @Override
    public E save(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        streams.compute(eventKey.apply(event), (key, stream) -> {
            List<E> appended = stream == null ? new ArrayList<>() : stream;
            appended.add(event);
            return appended;
        });
        return event;
    }

    /**
     * Returns a snapshot of one stream.
     *
     * @param key stream key
     * @return events of the stream in append order, empty if the stream does not exist
     */
    public List<E> streamOf(K key) {
        List<E> copy = new ArrayList<>();
        streams.computeIfPresent(key, (k, stream) -> {
            copy.addAll(stream);
            return stream;
        });
        return List.copyOf(copy);
    }

    /**
     * Removes every stream.
     */
    public void clear() {
        streams.clear();
    }

    protected K keyOfEvent(E event) {
        return eventKey.apply(event);
    }

    protected K keyOfCommand(C command) {
        return commandKey.apply(command);
    }
}
