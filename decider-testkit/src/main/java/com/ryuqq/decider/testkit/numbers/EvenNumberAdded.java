package com.ryuqq.decider.testkit.numbers;

public record EvenNumberAdded(int value) implements EvenNumberEvent {
}
