package com.ryuqq.decider.testkit.numbers;

/**
 * Commands of the odd-number aggregate.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface OddNumberCommand permits AddOddNumber, SubtractOddNumber {

    int value();
}
