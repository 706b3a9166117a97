package com.raava.concierge.dialogue.model;

import java.util.List;

/**
 * Result of advancing a funnel by one turn.
 *
 * @param stage         stage after the turn
 * @param missingFields labels of the fields the stage still needs
 * @param prompt        deterministic reply text for the stage
 * @param ready         true when the funnel reached READY and a record should be created
 * @param enteredStages stages entered during this turn, in order
 */
public record MachineOutcome(
        String stage,
        List<String> missingFields,
        String prompt,
        boolean ready,
        List<String> enteredStages) {
}
