package com.ryuqq.decider.testkit.numbers;

/**
 * Events of the odd-number aggregate.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface OddNumberEvent permits OddNumberAdded, OddNumberSubtracted {

    int value();
}
