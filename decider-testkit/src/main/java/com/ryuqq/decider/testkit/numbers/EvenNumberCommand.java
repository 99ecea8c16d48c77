package com.ryuqq.decider.testkit.numbers;

/**
 * Commands of the even-number aggregate.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface EvenNumberCommand permits AddEvenNumber, SubtractEvenNumber {

    int value();
}
