package com.raava.concierge.session.model;

/**
 * Domain funnel a session is currently in.
 */
public enum ActiveDomain {

    NONE("none"),
    ACQUISITION("vehicle acquisition"),
    SERVICE("service booking"),
    CONSIGNMENT("consignment");

    private final String description;

    ActiveDomain(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
