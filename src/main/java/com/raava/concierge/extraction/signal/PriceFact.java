package com.raava.concierge.extraction.signal;

/**
 * A sterling amount. {@code monthly} marks a per-month budget rather than a total price.
 */
public record PriceFact(double amount, boolean monthly) implements Signal {
}
