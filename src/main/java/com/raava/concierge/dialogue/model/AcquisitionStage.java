package com.raava.concierge.dialogue.model;

/**
 * Stages of the acquisition funnel, in order. READY is terminal.
 */
public enum AcquisitionStage {
    VEHICLE_SEARCH,
    VEHICLE_SELECTION,
    CUSTOMER_INFO,
    READY;

    public AcquisitionStage next() {
        AcquisitionStage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1] : null;
    }

    public boolean isReady() {
        return this == READY;
    }
}
