package com.raava.concierge.finance.service;

import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic finance calculators.
 *
 * All methods are pure: the same inputs always produce the same quote and nothing is
 * cached or persisted. The amortisation formula shared by Hire Purchase and Bespoke is
 * {@code M = P·r·(1+r)^n / ((1+r)^n − 1)} with {@code r = annualRate/12/100}; a zero rate
 * degenerates to {@code M = P/n}.
 *
 * PCP and Lease keep the existing business formulas: a straight-line depreciation component
 * plus a simple monthly charge, added rather than compounded.
 */
public final class FinanceEngine {

    private FinanceEngine() {}

    /**
     * Standard amortised monthly payment.
     *
     * @param principal         amount financed
     * @param annualRatePercent annual rate in percent (4.9 means 4.9%)
     * @param termMonths        number of monthly payments
     * @return monthly payment
     */
    public static double monthlyPayment(double principal, double annualRatePercent, int termMonths) {
        requireNonNegative(principal, "principal");
        requireNonNegative(annualRatePercent, "annualRatePercent");
        requirePositive(termMonths, "termMonths");

        double r = monthlyRate(annualRatePercent);
        if (r == 0) {
            return principal / termMonths;
        }
        double growth = Math.pow(1 + r, termMonths);
        return principal * r * growth / (growth - 1);
    }

    /**
     * Hire Purchase: finance {@code price − deposit}, no final payment.
     */
    public static FinanceQuote hirePurchase(double price, double deposit, double annualRatePercent, int termMonths) {
        validate(price, deposit, annualRatePercent, termMonths);

        double monthly = monthlyPayment(price - deposit, annualRatePercent, termMonths);
        double totalCost = monthly * termMonths + deposit;

        return new FinanceQuote(
                FinanceType.HP.getProductName(),
                annualRatePercent,
                monthly,
                totalCost,
                termMonths,
                deposit,
                null,
                totalCost - price);
    }

    /**
     * Personal Contract Purchase: depreciation to the residual plus simple interest on the
     * financed amount. The residual is due as the optional final payment.
     */
    public static FinanceQuote personalContractPurchase(double price, double deposit, double residual,
                                                        double annualRatePercent, int termMonths) {
        validate(price, deposit, annualRatePercent, termMonths);
        requireWithinPrice(residual, price, "residual");

        double depreciation = (price - residual) / termMonths;
        double interest = (price - deposit) * monthlyRate(annualRatePercent);
        double monthly = depreciation + interest;
        double paid = monthly * termMonths;

        return new FinanceQuote(
                FinanceType.PCP.getProductName(),
                annualRatePercent,
                monthly,
                deposit + paid,
                termMonths,
                deposit,
                residual,
                paid - (price - residual));
    }

    /**
     * Lease: depreciation to the residual plus a money-factor rent charge on
     * {@code price + residual}. No ownership and no final payment.
     */
    public static FinanceQuote lease(double price, double deposit, double residual,
                                     double annualRatePercent, int termMonths) {
        validate(price, deposit, annualRatePercent, termMonths);
        requireWithinPrice(residual, price, "residual");

        double depreciation = (price - residual) / termMonths;
        double rentCharge = monthlyRate(annualRatePercent) * (price + residual);
        double monthly = depreciation + rentCharge;
        double paid = monthly * termMonths;

        return new FinanceQuote(
                FinanceType.LEASE.getProductName(),
                annualRatePercent,
                monthly,
                paid + deposit,
                termMonths,
                deposit,
                null,
                paid - (price - residual));
    }

    /**
     * Bespoke: standard formula on {@code price − deposit − balloon}; the balloon is the
     * final payment when it is greater than zero.
     */
    public static FinanceQuote bespoke(double price, double deposit, double balloon,
                                       double annualRatePercent, int termMonths) {
        validate(price, deposit, annualRatePercent, termMonths);
        requireWithinPrice(balloon, price, "balloon");
        if (deposit + balloon > price) {
            throw new IllegalArgumentException("deposit + balloon must not exceed price");
        }

        double principal = price - deposit - balloon;
        double monthly = monthlyPayment(principal, annualRatePercent, termMonths);
        double paid = monthly * termMonths;

        return new FinanceQuote(
                FinanceType.BESPOKE.getProductName(),
                annualRatePercent,
                monthly,
                deposit + paid + balloon,
                termMonths,
                deposit,
                balloon > 0 ? balloon : null,
                paid - principal);
    }

    /**
     * Runs all four products with shared inputs.
     *
     * @return quotes keyed by product name, in the order HP, PCP, Lease, Bespoke
     */
    public static Map<String, FinanceQuote> compare(double price, double deposit, double residual, double balloon,
                                                    double annualRatePercent, int termMonths) {
        Map<String, FinanceQuote> quotes = new LinkedHashMap<>();
        put(quotes, hirePurchase(price, deposit, annualRatePercent, termMonths));
        put(quotes, personalContractPurchase(price, deposit, residual, annualRatePercent, termMonths));
        put(quotes, lease(price, deposit, residual, annualRatePercent, termMonths));
        put(quotes, bespoke(price, deposit, balloon, annualRatePercent, termMonths));
        return quotes;
    }

    /**
     * Inverse of {@link #monthlyPayment}: the most expensive vehicle a monthly budget covers.
     *
     * @param monthlyBudget     what the customer can pay each month
     * @param annualRatePercent annual rate in percent
     * @param termMonths        number of monthly payments
     * @param deposit           cash put down upfront
     * @return maximum vehicle price (financed principal plus deposit)
     */
    public static double maxAffordablePrice(double monthlyBudget, double annualRatePercent, int termMonths, double deposit) {
        requireNonNegative(monthlyBudget, "monthlyBudget");
        requireNonNegative(annualRatePercent, "annualRatePercent");
        requireNonNegative(deposit, "deposit");
        requirePositive(termMonths, "termMonths");

        double r = monthlyRate(annualRatePercent);
        if (r == 0) {
            return monthlyBudget * termMonths + deposit;
        }
        double growth = Math.pow(1 + r, termMonths);
        return monthlyBudget * (growth - 1) / (r * growth) + deposit;
    }

    private static void put(Map<String, FinanceQuote> quotes, FinanceQuote quote) {
        quotes.put(quote.productName(), quote);
    }

    private static double monthlyRate(double annualRatePercent) {
        return annualRatePercent / 12 / 100;
    }

    private static void validate(double price, double deposit, double annualRatePercent, int termMonths) {
        if (price <= 0) {
            throw new IllegalArgumentException("price must be positive");
        }
        requireWithinPrice(deposit, price, "deposit");
        requireNonNegative(annualRatePercent, "annualRatePercent");
        requirePositive(termMonths, "termMonths");
    }

    private static void requireWithinPrice(double value, double price, String name) {
        if (value < 0 || value > price) {
            throw new IllegalArgumentException(name + " must be between 0 and the price");
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
