package com.raava.concierge.inventory.service;

import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.inventory.model.Valuation;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ValuationCalculatorTest {

    private final ValuationCalculator calculator = new ValuationCalculator(
            Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC), 200_000);

    @Test
    void testValue_AgeAndMileageDepreciation() {
        // When
        Valuation valuation = calculator.value(vehicle(2022, 10_000));

        // Then
        assertEquals(new Valuation(81_480, 97_776, 112_442), valuation);
    }

    @Test
    void testValue_NewCar() {
        assertEquals(new Valuation(140_000, 168_000, 193_199), calculator.value(vehicle(2026, 0)));
    }

    @Test
    void testValue_FactorsAreFloored() {
        assertEquals(new Valuation(1_400, 1_680, 1_931), calculator.value(vehicle(1990, 500_000)));
    }

    @Test
    void testValue_MissingYearAndMileageTreatedAsNew() {
        assertEquals(new Valuation(140_000, 168_000, 193_199), calculator.value(VehicleDetails.builder().make("Ferrari").build()));
    }

    @Test
    void testValue_RetailAbovePrivateAboveTradeIn() {
        // When
        Valuation valuation = calculator.value(vehicle(2021, 20_000));

        // Then
        assertEquals(new Valuation(65_800, 78_960, 90_804), valuation);
        assertTrue(valuation.retail() > valuation.privateSale());
        assertTrue(valuation.privateSale() > valuation.tradeIn());
    }

    private static VehicleDetails vehicle(int year, int mileage) {
        return VehicleDetails.builder().make("Ferrari").model("F8 Tributo").year(year).mileage(mileage).build();
    }
}
