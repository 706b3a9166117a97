package com.raava.concierge.dialogue.model;

/**
 * Stages of the service booking funnel, in order. READY is terminal.
 */
public enum ServiceStage {
    VEHICLE_DETAILS,
    SERVICE_TYPE,
    CUSTOMER_DETAILS,
    PROVIDER_SELECTION,
    APPOINTMENT_DATE,
    READY;

    public ServiceStage next() {
        ServiceStage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1] : null;
    }

    public boolean isReady() {
        return this == READY;
    }
}
