package com.raava.concierge.finance.service;

import com.raava.concierge.finance.model.FinanceQuote;
import com.raava.concierge.finance.model.FinanceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the configured product terms to {@link FinanceEngine}.
 *
 * Responsibilities:
 * - Hold per-product rate, term, residual and deposit defaults
 * - Quote a single product for a vehicle price
 * - Compare every financed product for a vehicle price
 */
@Slf4j
@Service
public class FinanceOfferService {

    @Value("${raava.finance.deposit-percent:20}")
    private double depositPercent;

    @Value("${raava.finance.hp.rate:4.9}")
    private double hpRate;

    @Value("${raava.finance.hp.term-months:60}")
    private int hpTermMonths;

    @Value("${raava.finance.pcp.rate:3.9}")
    private double pcpRate;

    @Value("${raava.finance.pcp.term-months:36}")
    private int pcpTermMonths;

    @Value("${raava.finance.pcp.residual-percent:50}")
    private double pcpResidualPercent;

    @Value("${raava.finance.lease.rate:2.9}")
    private double leaseRate;

    @Value("${raava.finance.lease.term-months:36}")
    private int leaseTermMonths;

    @Value("${raava.finance.lease.residual-percent:40}")
    private double leaseResidualPercent;

    @Value("${raava.finance.lease.deposit-percent:10}")
    private double leaseDepositPercent;

    @Value("${raava.finance.bespoke.rate:1.9}")
    private double bespokeRate;

    @Value("${raava.finance.bespoke.term-months:60}")
    private int bespokeTermMonths;

    @Value("${raava.finance.bespoke.deposit-percent:25}")
    private double bespokeDepositPercent;

    @Value("${raava.finance.bespoke.balloon-percent:0}")
    private double bespokeBalloonPercent;

    /**
     * Quotes one product with the configured terms.
     *
     * @param financeType product to quote; must be a financed type
     * @param price       vehicle price
     * @return quote for the product
     * @throws IllegalArgumentException if {@code financeType} is CASH or the price is not positive
     */
    public FinanceQuote quote(FinanceType financeType, double price) {
        log.debug("Quoting finance - type: {}, price: {}", financeType, price);
        return switch (financeType) {
            case HP -> FinanceEngine.hirePurchase(price, percentOf(price, depositPercent), hpRate, hpTermMonths);
            case PCP -> FinanceEngine.personalContractPurchase(price, percentOf(price, depositPercent),
                    percentOf(price, pcpResidualPercent), pcpRate, pcpTermMonths);
            case LEASE -> FinanceEngine.lease(price, percentOf(price, leaseDepositPercent),
                    percentOf(price, leaseResidualPercent), leaseRate, leaseTermMonths);
            case BESPOKE -> FinanceEngine.bespoke(price, percentOf(price, bespokeDepositPercent),
                    percentOf(price, bespokeBalloonPercent), bespokeRate, bespokeTermMonths);
            case CASH -> throw new IllegalArgumentException("Cash purchases have no finance quote");
        };
    }

    /**
     * Quotes every financed product, each with its own configured terms.
     *
     * @param price vehicle price
     * @return quotes keyed by product name in the order HP, PCP, Lease, Bespoke
     */
    public Map<String, FinanceQuote> compareOffers(double price) {
        Map<String, FinanceQuote> offers = new LinkedHashMap<>();
        for (FinanceType type : FinanceType.values()) {
            if (type.isFinanced()) {
                FinanceQuote quote = quote(type, price);
                offers.put(quote.productName(), quote);
            }
        }
        return offers;
    }

    /**
     * Largest vehicle price a monthly budget supports on Hire Purchase terms.
     */
    public double maxAffordablePrice(double monthlyBudget, double deposit) {
        return FinanceEngine.maxAffordablePrice(monthlyBudget, hpRate, hpTermMonths, deposit);
    }

    private static double percentOf(double price, double percent) {
        return price * percent / 100;
    }
}
