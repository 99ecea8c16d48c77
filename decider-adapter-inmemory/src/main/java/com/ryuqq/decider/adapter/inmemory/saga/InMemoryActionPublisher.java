package com.ryuqq.decider.adapter.inmemory.saga;

import com.ryuqq.decider.core.spi.ActionPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ActionPublisher} that records actions in publication order.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryActionPublisher&lt;PaymentCommand&gt; publisher = new InMemoryActionPublisher&lt;&gt;();
 * new SagaManager&lt;&gt;(orderSaga, publisher).handle(orderPlaced);
 * assertThat(publisher.published()).containsExactly(new ChargePayment(...));
 * </pre>
 *
 * @param <A> Action type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryActionPublisher<A> implements ActionPublisher<A> {

    private final CopyOnWriteArrayList<A> published = new CopyOnWriteArrayList<>();

    @Override
    public A publish(A action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        published.add(action);
        return action;
    }

    /**
     * Returns every action published so far.
     *
     * @return actions in publication order
     */
    public List<A> published() {
        return List.copyOf(published);
    }

    public void clear() {
        published.clear();
    }
}
