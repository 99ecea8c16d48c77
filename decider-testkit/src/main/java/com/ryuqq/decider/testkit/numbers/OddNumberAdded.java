package com.ryuqq.decider.testkit.numbers;

public record OddNumberAdded(int value) implements OddNumberEvent {
}
