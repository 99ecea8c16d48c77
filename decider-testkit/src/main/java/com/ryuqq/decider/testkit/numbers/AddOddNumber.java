package com.ryuqq.decider.testkit.numbers;

/**
 * Adds an odd number.
 *
 * @param value the number to add
 */
public record AddOddNumber(int value) implements OddNumberCommand {
}
