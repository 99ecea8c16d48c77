package com.ryuqq.decider.testkit.numbers;

import com.ryuqq.decider.core.domain.Decider;
import com.ryuqq.decider.core.domain.Saga;
import com.ryuqq.decider.core.domain.View;
import com.ryuqq.decider.core.model.Either;
import com.ryuqq.decider.core.model.Pair;

import java.util.stream.Stream;

/**
 * Even/odd numbers sample domain.
 *
 * <p>Two independent aggregates keep a running total of even and odd numbers. Each command
 * produces one event carrying the command's value; evolving adds (or subtracts) it. A value
 * above {@link #MAX_VALUE} makes {@code decide} throw.</p>
 *
 * <p>{@link #numberSaga()} reacts to an even number {@code n} being added or subtracted with the
 * same operation on the odd number {@code n - 1}; the odd side never reacts, so orchestration
 * always terminates. {@link #cyclicNumberSaga()} also reacts on the odd side, which makes the two
 * sagas feed each other forever.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class Numbers {

    /** Largest value a command may carry. */
    public static final int MAX_VALUE = 1000;

    private Numbers() {
    }

    public static Decider<EvenNumberCommand, EvenNumberState, EvenNumberEvent> evenNumberDecider() {
        return Decider.<EvenNumberCommand, EvenNumberState, EvenNumberEvent>builder()
            .decide((c, s) -> Stream.of(decideEven(c)))
            .evolve((s, e) -> e instanceof EvenNumberAdded
                ? new EvenNumberState(s.value() + e.value())
                : new EvenNumberState(s.value() - e.value()))
            .initialState(EvenNumberState.INITIAL)
            .build();
    }

    public static Decider<OddNumberCommand, OddNumberState, OddNumberEvent> oddNumberDecider() {
        return Decider.<OddNumberCommand, OddNumberState, OddNumberEvent>builder()
            .decide((c, s) -> Stream.of(decideOdd(c)))
            .evolve((s, e) -> e instanceof OddNumberAdded
                ? new OddNumberState(s.value() + e.value())
                : new OddNumberState(s.value() - e.value()))
            .initialState(OddNumberState.INITIAL)
            .build();
    }

    /**
     * Even and odd deciders combined: left is even, right is odd.
     *
     * @return the combined decider
     */
    public static Decider<Either<EvenNumberCommand, OddNumberCommand>,
        Pair<EvenNumberState, OddNumberState>,
        Either<EvenNumberEvent, OddNumberEvent>> numberDecider() {
        return evenNumberDecider().combine(oddNumberDecider());
    }

    public static View<EvenNumberState, EvenNumberEvent> evenNumberView() {
        return View.of(
            (s, e) -> e instanceof EvenNumberAdded
                ? new EvenNumberState(s.value() + e.value())
                : new EvenNumberState(s.value() - e.value()),
            EvenNumberState.INITIAL
        );
    }

    public static View<OddNumberState, OddNumberEvent> oddNumberView() {
        return View.of(
            (s, e) -> e instanceof OddNumberAdded
                ? new OddNumberState(s.value() + e.value())
                : new OddNumberState(s.value() - e.value()),
            OddNumberState.INITIAL
        );
    }

    public static View<Pair<EvenNumberState, OddNumberState>, Either<EvenNumberEvent, OddNumberEvent>> numberView() {
        return evenNumberView().combine(oddNumberView());
    }

    /**
     * Even number {@code n} added or subtracted → same operation with odd number {@code n - 1}.
     *
     * @return the even-side saga
     */
    public static Saga<EvenNumberEvent, OddNumberCommand> evenNumberSaga() {
        return Saga.of(e -> e instanceof EvenNumberAdded
            ? Stream.of(new AddOddNumber(e.value() - 1))
            : Stream.of(new SubtractOddNumber(e.value() - 1)));
    }

    /**
     * Odd number {@code n} added or subtracted → same operation with even number {@code n + 1}.
     *
     * @return the odd-side saga
     */
    public static Saga<OddNumberEvent, EvenNumberCommand> oddNumberSaga() {
        return Saga.of(e -> e instanceof OddNumberAdded
            ? Stream.of(new AddEvenNumber(e.value() + 1))
            : Stream.of(new SubtractEvenNumber(e.value() + 1)));
    }

    /**
     * Saga for the combined decider that reacts to even events only.
     *
     * @return the terminating number saga
     */
    public static Saga<Either<EvenNumberEvent, OddNumberEvent>, Either<EvenNumberCommand, OddNumberCommand>> numberSaga() {
        return evenNumberSaga()
            .combine(Saga.<OddNumberEvent, EvenNumberCommand>empty())
            .mapOnAction(Either::swap);
    }

    /**
     * Saga for the combined decider that reacts on both sides, so every command leads to another.
     *
     * @return the never-terminating number saga
     */
    public static Saga<Either<EvenNumberEvent, OddNumberEvent>, Either<EvenNumberCommand, OddNumberCommand>> cyclicNumberSaga() {
        return evenNumberSaga()
            .combine(oddNumberSaga())
            .mapOnAction(Either::swap);
    }

    public static Either<EvenNumberCommand, OddNumberCommand> even(EvenNumberCommand command) {
        return Either.left(command);
    }

    public static Either<EvenNumberCommand, OddNumberCommand> odd(OddNumberCommand command) {
        return Either.right(command);
    }

    public static Either<EvenNumberEvent, OddNumberEvent> evenEvent(EvenNumberEvent event) {
        return Either.left(event);
    }

    public static Either<EvenNumberEvent, OddNumberEvent> oddEvent(OddNumberEvent event) {
        return Either.right(event);
    }

    private static EvenNumberEvent decideEven(EvenNumberCommand command) {
        requireWithinLimit(command.value());
        if (command instanceof AddEvenNumber) {
            return new EvenNumberAdded(command.value());
        }
        return new EvenNumberSubtracted(command.value());
    }

    private static OddNumberEvent decideOdd(OddNumberCommand command) {
        requireWithinLimit(command.value());
        if (command instanceof AddOddNumber) {
            return new OddNumberAdded(command.value());
        }
        return new OddNumberSubtracted(command.value());
    }

    private static void requireWithinLimit(int value) {
        if (value > MAX_VALUE) {
            throw new UnsupportedOperationException("value " + value + " exceeds " + MAX_VALUE);
        }
    }
}
