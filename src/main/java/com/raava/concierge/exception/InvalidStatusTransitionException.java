package com.raava.concierge.exception;

/**
 * Thrown when a record status change is not allowed, e.g. reopening a cancelled order.
 */
public class InvalidStatusTransitionException extends RaavaException {

    public InvalidStatusTransitionException(String message) {
        super(RaavaErrorCode.INVALID_STATUS_TRANSITION, message, false);
    }
}
