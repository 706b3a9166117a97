package com.raava.concierge.dialogue.model;

/**
 * Stages of the consignment funnel, in order. READY is terminal.
 */
public enum ConsignmentStage {
    VEHICLE_DETAILS,
    SALE_DETAILS,
    OWNER_DETAILS,
    LISTING_REVIEW,
    READY;

    public ConsignmentStage next() {
        ConsignmentStage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1] : null;
    }

    public boolean isReady() {
        return this == READY;
    }
}
