package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.ServiceType;
import com.raava.concierge.dialogue.model.SlotField;
import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.Confirmation;
import com.raava.concierge.extraction.signal.FinancePreference;
import com.raava.concierge.extraction.signal.FreeTextAnswer;
import com.raava.concierge.extraction.signal.ServiceRequest;
import com.raava.concierge.extraction.signal.Signal;
import com.raava.concierge.finance.model.FinanceType;
import com.raava.concierge.session.model.ActiveDomain;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Detectors driven by fixed word lists.
 */
class KeywordDetectorsTest {

    private final StageExpectation none = StageExpectation.nothing();

    @Test
    void testConfirmation_PositiveAndNegative() {
        ConfirmationDetector detector = new ConfirmationDetector();

        assertEquals(Optional.<Signal>of(new Confirmation(true)), detector.detect("Yes please", none));
        assertEquals(Optional.<Signal>of(new Confirmation(true)), detector.detect("sounds good, list it", none));
        assertEquals(Optional.<Signal>of(new Confirmation(false)), detector.detect("no, not yet", none));
        assertTrue(detector.detect("maybe later", none).isEmpty());
    }

    @Test
    void testFreeTextAnswer_StripsLeadIn() {
        // Given
        FreeTextAnswerDetector detector = new FreeTextAnswerDetector();
        StageExpectation askingReason = StageExpectation.freeText(SlotField.REASON_FOR_SALE);

        // When
        Optional<Signal> signal = detector.detect("Because I'm upgrading to a newer model.", askingReason);

        // Then
        assertEquals(Optional.<Signal>of(new FreeTextAnswer(SlotField.REASON_FOR_SALE, "I'm upgrading to a newer model")), signal);
    }

    @Test
    void testFreeTextAnswer_OnlyWhenAnOpenQuestionWasAsked() {
        FreeTextAnswerDetector detector = new FreeTextAnswerDetector();

        assertTrue(detector.detect("Upgrading", none).isEmpty());
        assertTrue(detector.detect("42", StageExpectation.freeText(SlotField.MODEL)).isEmpty());
        assertTrue(detector.detect("thanks!", StageExpectation.freeText(SlotField.MODEL)).isEmpty());
    }

    @Test
    void testServiceRequest_SpecificWorkWinsOverGenericService() {
        ServiceRequestDetector detector = new ServiceRequestDetector();

        assertEquals(ServiceType.BRAKES, serviceType(detector.detect("my brakes are squeaking", none)));
        assertEquals(ServiceType.MOT, serviceType(detector.detect("needs an MOT and a service", none)));
        assertEquals(ServiceType.ANNUAL_SERVICE, serviceType(detector.detect("it's due a service", none)));
        assertTrue(detector.detect("hello", none).isEmpty());
    }

    @Test
    void testFinancePreference_PlainFinanceMeansHirePurchase() {
        FinancePreferenceDetector detector = new FinancePreferenceDetector();

        assertEquals(Optional.<Signal>of(new FinancePreference(FinanceType.PCP)), detector.detect("on PCP please", none));
        assertEquals(Optional.<Signal>of(new FinancePreference(FinanceType.HP)), detector.detect("I'd like finance", none));
        assertEquals(Optional.<Signal>of(new FinancePreference(FinanceType.CASH)), detector.detect("paying cash", none));
        assertTrue(detector.detect("hello", none).isEmpty());
    }

    @Test
    void testDomainLexicon_KeywordPriority() {
        assertEquals(Optional.of(ActiveDomain.ACQUISITION),
                DomainLexicon.classify("I want to buy a car"));
        assertEquals(Optional.of(ActiveDomain.SERVICE),
                DomainLexicon.classify("book a service for my car"));
        assertEquals(Optional.of(ActiveDomain.CONSIGNMENT),
                DomainLexicon.classify("I want to sell my car"));
        assertEquals(Optional.of(ActiveDomain.ACQUISITION),
                DomainLexicon.classify("Ferrari"));
        assertTrue(DomainLexicon.classify("what time is it").isEmpty());
    }

    @Test
    void testDomainLexicon_GreetingAndLabels() {
        assertTrue(DomainLexicon.isGreeting("Hello there!"));
        assertFalse(DomainLexicon.isGreeting("hello, I want to buy a car"));
        assertEquals(Optional.of(ActiveDomain.SERVICE), DomainLexicon.parseLabel(" SERVICE."));
        assertEquals(Optional.of(ActiveDomain.CONSIGNMENT), DomainLexicon.parseLabel("consignment"));
        assertTrue(DomainLexicon.parseLabel("NONE").isEmpty());
    }

    private static ServiceType serviceType(Optional<Signal> signal) {
        return ((ServiceRequest) signal.orElseThrow()).serviceType();
    }
}
