package com.ryuqq.decider.testkit.numbers;

public record OddNumberSubtracted(int value) implements OddNumberEvent {
}
