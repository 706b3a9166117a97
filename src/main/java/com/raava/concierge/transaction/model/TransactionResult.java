package com.raava.concierge.transaction.model;

import java.util.List;

/**
 * Outcome of a record creation attempt.
 */
public interface TransactionResult {

    /**
     * A new record was stored. {@code warnings} lists non-fatal problems such as a failed
     * confirmation email.
     */
    record Created(String recordId, String message, List<String> warnings) implements TransactionResult {
    }

    /**
     * The funnel already produced a record; nothing was written.
     */
    record AlreadyCreated(String recordId, String message) implements TransactionResult {
    }

    /**
     * Required fields are still missing, named by their user-facing labels.
     */
    record Incomplete(List<String> missingFields) implements TransactionResult {
    }
}
