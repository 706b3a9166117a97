package com.raava.concierge.inventory.model;

/**
 * Estimated market values of a vehicle, in whole pounds.
 */
public record Valuation(long tradeIn, long privateSale, long retail) {
}
