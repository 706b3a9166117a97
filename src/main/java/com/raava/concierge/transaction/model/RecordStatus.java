package com.raava.concierge.transaction.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a business record: pending, then confirmed, then completed. Pending and
 * confirmed records can be cancelled. Completed and cancelled are terminal.
 */
public enum RecordStatus {

    PENDING,
    CONFIRMED,
    COMPLETED,
    CANCELLED;

    /**
     * Lowercase form stored in records.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RecordStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value().equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown record status: " + value));
    }

    public boolean canTransitionTo(RecordStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    private Set<RecordStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> Set.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> Set.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> Set.of();
        };
    }
}
