package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.ContactFact;
import com.raava.concierge.extraction.signal.Signal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContactFactDetectorTest {

    private final ContactFactDetector detector = new ContactFactDetector();
    private final StageExpectation askingForContact =
            StageExpectation.fields(List.of(SlotField.NAME, SlotField.EMAIL, SlotField.PHONE));

    @Test
    void testDetect_AllDetailsInOneMessage() {
        // When
        Optional<Signal> signal = detector.detect("John Smith john@x.com +447000000000", askingForContact);

        // Then
        assertEquals(Optional.<Signal>of(new ContactFact("John Smith", "john@x.com", "+447000000000", null)), signal);
    }

    @Test
    void testDetect_UkMobileWithSpaces() {
        // When
        ContactFact fact = (ContactFact) detector.detect("you can reach me on 07700 900 123", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals("07700900123", fact.phone());
        assertNull(fact.name());
    }

    @Test
    void testDetect_ExplicitNameWithoutExpectation() {
        // When
        ContactFact fact = (ContactFact) detector.detect("my name is jane doe", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals("Jane Doe", fact.name());
    }

    @Test
    void testDetect_PostcodeIsNormalised() {
        // When
        ContactFact fact = (ContactFact) detector.detect("postcode sw1a1aa", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals("SW1A 1AA", fact.postcode());
    }

    @Test
    void testDetect_LeadingWordsAreNotANameUnlessAsked() {
        // When
        ContactFact fact = (ContactFact) detector.detect("John Smith, john@x.com", StageExpectation.nothing()).orElseThrow();

        // Then
        assertNull(fact.name());
        assertEquals("john@x.com", fact.email());
    }

    @Test
    void testDetect_VehicleWordsAreNotAName() {
        assertTrue(detector.detect("Ferrari Roma", askingForContact).isEmpty());
        assertTrue(detector.detect("yes", askingForContact).isEmpty());
    }
}
