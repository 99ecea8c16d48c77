package com.ryuqq.decider.testkit.numbers;

/**
 * Running total of the even-number aggregate.
 *
 * @param value current total
 */
public record EvenNumberState(int value) {

    public static final EvenNumberState INITIAL = new EvenNumberState(0);
}
