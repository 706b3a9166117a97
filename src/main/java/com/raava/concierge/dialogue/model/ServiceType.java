package com.raava.concierge.dialogue.model;

public enum ServiceType {

    MOT("MOT"),
    ANNUAL_SERVICE("Annual service"),
    MAJOR_SERVICE("Major service"),
    BRAKES("Brake service"),
    TYRES("Tyre service"),
    OIL_CHANGE("Oil change"),
    DIAGNOSTICS("Diagnostics"),
    REPAIR("Repair"),
    UPGRADE("Upgrade");

    private final String displayName;

    ServiceType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
