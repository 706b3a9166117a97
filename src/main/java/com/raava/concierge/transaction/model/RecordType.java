package com.raava.concierge.transaction.model;

/**
 * Business records a funnel can create.
 */
public enum RecordType {

    ORDER("ORD", "orders", "orderId", "customer"),
    APPOINTMENT("SVC", "appointments", "appointmentId", "customer"),
    LISTING("LST", "listings", "listingId", "owner");

    private final String idPrefix;
    private final String collection;
    private final String idField;
    private final String partyField;

    RecordType(String idPrefix, String collection, String idField, String partyField) {
        this.idPrefix = idPrefix;
        this.collection = collection;
        this.idField = idField;
        this.partyField = partyField;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public String getCollection() {
        return collection;
    }

    public String getIdField() {
        return idField;
    }

    /**
     * Section holding the contact details of the person the record belongs to.
     */
    public String getPartyField() {
        return partyField;
    }
}
