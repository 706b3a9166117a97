package com.raava.concierge.finance.service;

import com.raava.concierge.finance.model.FinanceQuote;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FinanceEngineTest {

    private static final double PENNY = 0.01;

    @Test
    void testHirePurchase_StandardTerms() {
        // Given
        double price = 200_000;
        double deposit = 40_000;

        // When
        FinanceQuote quote = FinanceEngine.hirePurchase(price, deposit, 4.9, 60);

        // Then
        assertEquals("Hire Purchase", quote.productName());
        assertEquals(3012.07, quote.monthlyPayment(), PENNY);
        assertEquals(220_724.35, quote.totalCost(), PENNY);
        assertEquals(20_724.35, quote.totalInterest(), PENNY);
        assertNull(quote.finalPayment());
        assertFalse(quote.hasFinalPayment());
    }

    @Test
    void testHirePurchase_TotalIsDepositPlusPayments() {
        // Given
        double deposit = 15_000;

        // When
        FinanceQuote quote = FinanceEngine.hirePurchase(95_000, deposit, 6.5, 48);

        // Then
        assertEquals(deposit + quote.monthlyPayment() * 48, quote.totalCost(), 1e-6);
    }

    @Test
    void testBespoke_TotalIsDepositPaymentsAndBalloon() {
        // Given
        double deposit = 50_000;
        double balloon = 30_000;

        // When
        FinanceQuote quote = FinanceEngine.bespoke(200_000, deposit, balloon, 1.9, 60);

        // Then
        assertEquals(deposit + quote.monthlyPayment() * 60 + balloon, quote.totalCost(), 1e-6);
        assertEquals(balloon, quote.finalPayment());
        assertTrue(quote.hasFinalPayment());
    }

    @Test
    void testBespoke_NoBalloonHasNoFinalPayment() {
        // When
        FinanceQuote quote = FinanceEngine.bespoke(200_000, 50_000, 0, 1.9, 60);

        // Then
        assertEquals(2622.61, quote.monthlyPayment(), PENNY);
        assertNull(quote.finalPayment());
    }

    @Test
    void testPersonalContractPurchase_DepreciationPlusInterest() {
        // When
        FinanceQuote quote = FinanceEngine.personalContractPurchase(200_000, 40_000, 100_000, 3.9, 36);

        // Then
        assertEquals(3297.78, quote.monthlyPayment(), PENNY);
        assertEquals(100_000, quote.finalPayment());
        assertEquals(40_000 + quote.monthlyPayment() * 36, quote.totalCost(), 1e-6);
        assertEquals(quote.monthlyPayment() * 36 - 100_000, quote.totalInterest(), 1e-6);
    }

    @Test
    void testLease_RentChargeOnPricePlusResidual() {
        // When
        FinanceQuote quote = FinanceEngine.lease(200_000, 20_000, 80_000, 2.9, 36);

        // Then
        assertEquals(4010.00, quote.monthlyPayment(), PENNY);
        assertNull(quote.finalPayment());
        assertEquals(4010.00 * 36 + 20_000, quote.totalCost(), PENNY);
    }

    @Test
    void testZeroRate_EveryProductPaysPriceOverTerm() {
        // Given
        double price = 120_000;
        int term = 48;

        // When
        Map<String, FinanceQuote> quotes = FinanceEngine.compare(price, 0, 0, 0, 0, term);

        // Then
        assertEquals(4, quotes.size());
        for (FinanceQuote quote : quotes.values()) {
            assertEquals(price / term, quote.monthlyPayment(), 1e-9, quote.productName());
        }
    }

    @Test
    void testCompare_KeepsProductOrder() {
        // When
        Map<String, FinanceQuote> quotes = FinanceEngine.compare(150_000, 30_000, 60_000, 0, 4.9, 48);

        // Then
        assertEquals(List.of("Hire Purchase", "Personal Contract Purchase", "Lease", "Bespoke"),
                List.copyOf(quotes.keySet()));
    }

    @Test
    void testMaxAffordablePrice_InvertsMonthlyPayment() {
        // Given
        double budget = 1_000;

        // When
        double price = FinanceEngine.maxAffordablePrice(budget, 4.9, 60, 0);

        // Then
        assertEquals(53_119.57, price, PENNY);
        assertEquals(budget, FinanceEngine.monthlyPayment(price, 4.9, 60), 1e-6);
    }

    @Test
    void testMaxAffordablePrice_ZeroRateAddsDeposit() {
        // When
        double price = FinanceEngine.maxAffordablePrice(2_000, 0, 36, 10_000);

        // Then
        assertEquals(82_000, price, 1e-9);
    }

    @Test
    void testValidation_RejectsBadInputs() {
        assertThrows(IllegalArgumentException.class, () -> FinanceEngine.hirePurchase(0, 0, 4.9, 60));
        assertThrows(IllegalArgumentException.class, () -> FinanceEngine.hirePurchase(100_000, 0, 4.9, 0));
        assertThrows(IllegalArgumentException.class, () -> FinanceEngine.hirePurchase(100_000, 0, -1, 60));
        assertThrows(IllegalArgumentException.class, () -> FinanceEngine.hirePurchase(100_000, 150_000, 4.9, 60));
        assertThrows(IllegalArgumentException.class, () -> FinanceEngine.bespoke(100_000, 60_000, 50_000, 1.9, 60));
    }
}
