package com.ryuqq.decider.testkit.numbers;

/**
 * Running total of the odd-number aggregate.
 *
 * @param value current total
 */
public record OddNumberState(int value) {

    public static final OddNumberState INITIAL = new OddNumberState(0);
}
