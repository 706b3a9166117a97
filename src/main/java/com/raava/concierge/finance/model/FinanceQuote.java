package com.raava.concierge.finance.model;

/**
 * Immutable result of a finance calculation.
 * Figures are unrounded; callers format them for display.
 *
 * @param productName       product the quote was computed for (e.g. "Hire Purchase")
 * @param annualRatePercent annual rate used, in percent
 * @param monthlyPayment    payment due each month
 * @param totalCost         everything the customer pays over the agreement
 * @param termMonths        agreement length in months
 * @param deposit           upfront payment
 * @param finalPayment      optional final (balloon/residual) payment, null when there is none
 * @param totalInterest     interest or rent charge over the agreement
 */
public record FinanceQuote(
        String productName,
        double annualRatePercent,
        double monthlyPayment,
        double totalCost,
        int termMonths,
        double deposit,
        Double finalPayment,
        double totalInterest) {

    public boolean hasFinalPayment() {
        return finalPayment != null && finalPayment > 0;
    }
}
