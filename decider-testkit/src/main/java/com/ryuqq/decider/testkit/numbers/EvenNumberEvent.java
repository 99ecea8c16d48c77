package com.ryuqq.decider.testkit.numbers;

/**
 * Events of the even-number aggregate.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface EvenNumberEvent permits EvenNumberAdded, EvenNumberSubtracted {

    int value();
}
