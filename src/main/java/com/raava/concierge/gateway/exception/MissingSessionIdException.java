package com.raava.concierge.gateway.exception;

/**
 * Exception thrown when the X-Session-ID header is missing.
 */
public class MissingSessionIdException extends RuntimeException {

    public MissingSessionIdException(String message) {
        super(message);
    }
}
