package com.ryuqq.decider.testkit.numbers;

/**
 * Adds an even number.
 *
 * @param value the number to add
 */
public record AddEvenNumber(int value) implements EvenNumberCommand {
}
