package com.raava.concierge.gateway.exception;

/**
 * Exception thrown when a session sends more messages than the rate limit allows.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
