package com.ryuqq.decider.core.spi;

import java.util.ArrayList;
import java.util.List;

/**
 * Outbound port for actions produced by a saga.
 *
 * <p>Typical implementations hand the action to a command bus or a message broker.</p>
 *
 * @param <A> action type
 * @author Decider Team
 * @since 1.0.0
 */
public interface ActionPublisher<A> {

    /**
     * Publishes one action.
     *
     * @param action the action
     * @return the published action
     */
    A publish(A action);

    /**
     * Publishes actions in the given order, stopping at the first failure.
     *
     * @param actions the actions
     * @return the published actions, in order
     */
    default List<A> publish(List<A> actions) {
        List<A> published = new ArrayList<>(actions.size());
        for (A action : actions) {
            published.add(publish(action));
        }
        return published;
    }
}
