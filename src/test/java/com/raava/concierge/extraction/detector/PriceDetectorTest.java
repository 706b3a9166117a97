package com.raava.concierge.extraction.detector;

import com.raava.concierge.dialogue.model.StageExpectation;
import com.raava.concierge.extraction.signal.PriceFact;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceDetectorTest {

    private final PriceDetector detector = new PriceDetector();

    @Test
    void testDetect_PoundSignWithSuffix() {
        // When
        PriceFact price = (PriceFact) detector.detect("budget is £250k", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals(250_000, price.amount(), 1e-6);
        assertFalse(price.monthly());
    }

    @Test
    void testDetect_Millions() {
        // When
        PriceFact price = (PriceFact) detector.detect("up to £1.2m", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals(1_200_000, price.amount(), 1e-6);
    }

    @Test
    void testDetect_MonthlyBudget() {
        // When
        PriceFact price = (PriceFact) detector.detect("around £3,000 a month", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals(3_000, price.amount(), 1e-6);
        assertTrue(price.monthly());
    }

    @Test
    void testDetect_CurrencyWord() {
        // When
        PriceFact price = (PriceFact) detector.detect("150k pounds", StageExpectation.nothing()).orElseThrow();

        // Then
        assertEquals(150_000, price.amount(), 1e-6);
    }

    @Test
    void testDetect_BareNumberIsNotAPrice() {
        assertTrue(detector.detect("250000", StageExpectation.nothing()).isEmpty());
        assertTrue(detector.detect("12k miles", StageExpectation.nothing()).isEmpty());
    }
}
