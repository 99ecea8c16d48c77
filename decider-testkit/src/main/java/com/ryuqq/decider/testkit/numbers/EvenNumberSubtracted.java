package com.ryuqq.decider.testkit.numbers;

public record EvenNumberSubtracted(int value) implements EvenNumberEvent {
}
