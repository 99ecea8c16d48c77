package com.ryuqq.decider.testkit.numbers;

/**
 * Subtracts an even number.
 *
 * @param value the number to subtract
 */
public record SubtractEvenNumber(int value) implements EvenNumberCommand {
}
