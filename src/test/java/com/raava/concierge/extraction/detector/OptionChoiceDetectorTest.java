package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.OptionChoice;
import com.raava.concierge.extraction.signal.Signal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OptionChoiceDetectorTest {

    private final OptionChoiceDetector detector = new OptionChoiceDetector();
    private final StageExpectation threeOptions = StageExpectation.choice(3, SlotField.SELECTED_VEHICLE);

    @Test
    void testDetect_BareNumber() {
        assertEquals(Optional.<Signal>of(new OptionChoice(2)), detector.detect("2", threeOptions));
        assertEquals(Optional.<Signal>of(new OptionChoice(1)), detector.detect(" #1. ", threeOptions));
    }

    @Test
    void testDetect_LabelledAndOrdinal() {
        assertEquals(Optional.<Signal>of(new OptionChoice(3)), detector.detect("I'll take option 3", threeOptions));
        assertEquals(Optional.<Signal>of(new OptionChoice(2)), detector.detect("the 2nd looks great", threeOptions));
        assertEquals(Optional.<Signal>of(new OptionChoice(2)), detector.detect("the second one", threeOptions));
        assertEquals(Optional.<Signal>of(new OptionChoice(3)), detector.detect("the last one please", threeOptions));
    }

    @Test
    void testDetect_NumberOutsideTheList() {
        assertTrue(detector.detect("5", threeOptions).isEmpty());
        assertTrue(detector.detect("0", threeOptions).isEmpty());
    }

    @Test
    void testDetect_InactiveWithoutOptions() {
        assertTrue(detector.detect("2", StageExpectation.nothing()).isEmpty());
        assertTrue(detector.detect("2", StageExpectation.fields(List.of(SlotField.MILEAGE))).isEmpty());
    }
}
