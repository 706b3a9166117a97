package com.raava.concierge.finance.model;

/**
 * Payment methods a customer can choose when acquiring a vehicle.
 */
public enum FinanceType {

    CASH("Cash"),
    HP("Hire Purchase"),
    PCP("Personal Contract Purchase"),
    LEASE("Lease"),
    BESPOKE("Bespoke");

    private final String productName;

    FinanceType(String productName) {
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }

    public boolean isFinanced() {
        return this != CASH;
    }
}
