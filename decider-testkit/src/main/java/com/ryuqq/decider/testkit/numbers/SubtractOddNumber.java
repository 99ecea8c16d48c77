package com.ryuqq.decider.testkit.numbers;

/**
 * Subtracts an odd number.
 *
 * @param value the number to subtract
 */
public record SubtractOddNumber(int value) implements OddNumberCommand {
}
