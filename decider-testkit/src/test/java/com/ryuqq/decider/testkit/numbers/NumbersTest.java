package com.ryuqq.decider.testkit.numbers;

import com.ryuqq.decider.core.model.Pair;
import com.ryuqq.decider.testkit.specification.DeciderSpecification;
import com.ryuqq.decider.testkit.specification.ViewSpecification;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static com.ryuqq.decider.testkit.numbers.Numbers.even;
import static com.ryuqq.decider.testkit.numbers.Numbers.evenEvent;
import static com.ryuqq.decider.testkit.numbers.Numbers.odd;
import static com.ryuqq.decider.testkit.numbers.Numbers.oddEvent;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the number fixtures through the given/when/then specifications.
 */
class NumbersTest {

    @Test
    void evenDecider_AddOnExistingEvents_EmitsAddedAndAccumulates() {
        DeciderSpecification.forDecider(Numbers.evenNumberDecider())
            .given(new EvenNumberAdded(2))
            .when(new AddEvenNumber(4))
            .thenEvents(new EvenNumberAdded(4))
            .thenState(new EvenNumberState(6));
    }

    @Test
    void evenDecider_Subtract_EmitsSubtracted() {
        DeciderSpecification.forDecider(Numbers.evenNumberDecider())
            .givenState(new EvenNumberState(10))
            .when(new SubtractEvenNumber(4))
            .thenEvents(new EvenNumberSubtracted(4))
            .thenState(new EvenNumberState(6));
    }

    @Test
    void oddDecider_ValueAboveLimit_Throws() {
        DeciderSpecification.forDecider(Numbers.oddNumberDecider())
            .given()
            .when(new AddOddNumber(Numbers.MAX_VALUE + 1))
            .thenThrows(UnsupportedOperationException.class);
    }

    @Test
    void numberDecider_RoutesEachSideToItsOwnState() {
        DeciderSpecification.forDecider(Numbers.numberDecider())
            .given(evenEvent(new EvenNumberAdded(2)), oddEvent(new OddNumberAdded(1)))
            .when(odd(new AddOddNumber(3)))
            .thenEvents(oddEvent(new OddNumberAdded(3)))
            .thenState(Pair.of(new EvenNumberState(2), new OddNumberState(4)));
    }

    @Test
    void numberView_FoldsBothSides() {
        ViewSpecification.forView(Numbers.numberView())
            .given(evenEvent(new EvenNumberAdded(8)), oddEvent(new OddNumberAdded(5)),
                evenEvent(new EvenNumberSubtracted(2)))
            .thenState(Pair.of(new EvenNumberState(6), new OddNumberState(5)));
    }

    @Test
    void evenView_NoEvents_KeepsInitialState() {
        ViewSpecification.forView(Numbers.evenNumberView())
            .given()
            .thenState(EvenNumberState.INITIAL);
    }

    @Test
    void numberSaga_ReactsToEvenEventsOnly() {
        assertThat(Numbers.numberSaga().react(evenEvent(new EvenNumberAdded(4))).collect(Collectors.toList()))
            .containsExactly(odd(new AddOddNumber(3)));
        assertThat(Numbers.numberSaga().react(oddEvent(new OddNumberAdded(3))).collect(Collectors.toList()))
            .isEmpty();
    }

    @Test
    void cyclicNumberSaga_ReactsOnBothSides() {
        assertThat(Numbers.cyclicNumberSaga().react(oddEvent(new OddNumberSubtracted(3))).collect(Collectors.toList()))
            .containsExactly(even(new SubtractEvenNumber(4)));
    }
}
