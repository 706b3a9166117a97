package com.raava.concierge.inventory.service;

import com.raava.concierge.dialogue.model.VehicleDetails;
import com.raava.concierge.inventory.model.Valuation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;

/**
 * Estimates what a customer's car is worth.
 *
 * Trade-in is the base value less 10% per year of age and 3% per 10,000 miles, times 0.7.
 * Private sale is trade-in plus 20%, retail is private sale plus 15%. Each depreciation factor
 * is floored at 10% so very old or high-mileage cars still get a positive figure.
 */
@Slf4j
@Service
public class ValuationCalculator {

    private static final double AGE_DEPRECIATION_PER_YEAR = 0.10;
    private static final double MILEAGE_DEPRECIATION_PER_10K = 0.03;
    private static final double MIN_FACTOR = 0.10;
    private static final double TRADE_IN_RATIO = 0.7;
    private static final double PRIVATE_SALE_UPLIFT = 1.2;
    private static final double RETAIL_UPLIFT = 1.15;

    private final Clock clock;
    private final double baseValue;

    public ValuationCalculator(Clock clock, @Value("${raava.valuation.base-value:200000}") double baseValue) {
        this.clock = clock;
        this.baseValue = baseValue;
    }

    public Valuation value(VehicleDetails vehicle) {
        int currentYear = Year.now(clock).getValue();
        int year = vehicle.getYear() != null ? vehicle.getYear() : currentYear;
        int mileage = vehicle.getMileage() != null ? vehicle.getMileage() : 0;

        double ageFactor = Math.max(MIN_FACTOR, 1 - Math.max(0, currentYear - year) * AGE_DEPRECIATION_PER_YEAR);
        double mileageFactor = Math.max(MIN_FACTOR, 1 - (mileage / 10_000.0) * MILEAGE_DEPRECIATION_PER_10K);

        long tradeIn = (long) (baseValue * ageFactor * mileageFactor * TRADE_IN_RATIO);
        long privateSale = (long) (tradeIn * PRIVATE_SALE_UPLIFT);
        long retail = (long) (privateSale * RETAIL_UPLIFT);

        log.debug("Valuation computed - vehicle: {}, tradeIn: {}, privateSale: {}, retail: {}",
                vehicle.describe(), tradeIn, privateSale, retail);
        return new Valuation(tradeIn, privateSale, retail);
    }
}
