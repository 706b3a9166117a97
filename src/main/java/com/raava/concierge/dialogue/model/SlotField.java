package com.raava.concierge.dialogue.model;

/**
 * Named pieces of information a funnel collects. The label is what users see when a
 * field is still missing.
 */
public enum SlotField {

    MAKE("Vehicle make"),
    MODEL("Vehicle model"),
    YEAR("Vehicle year"),
    MILEAGE("Mileage"),
    COLOR("Colour"),
    SELECTED_VEHICLE("Vehicle selection"),
    FINANCE_TYPE("Payment method"),
    NAME("Full name"),
    EMAIL("Email address"),
    PHONE("Phone number"),
    POSTCODE("Postcode"),
    SERVICE_TYPE("Service type"),
    SELECTED_PROVIDER("Service provider"),
    APPOINTMENT_DATE("Appointment date"),
    REASON_FOR_SALE("Reason for sale"),
    ASKING_PRICE("Asking price"),
    LISTING_APPROVAL("Listing approval");

    private final String label;

    SlotField(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
