package com.raava.concierge.exception;

/**
 * Thrown when the record store cannot be read or written.
 * Always retryable: the turn that hit it leaves the session untouched.
 */
public class PersistenceException extends RaavaException {

    public PersistenceException(String message) {
        super(RaavaErrorCode.PERSISTENCE_FAILURE, message, true);
    }

    public PersistenceException(String message, Throwable cause) {
        super(RaavaErrorCode.PERSISTENCE_FAILURE, message, true, cause);
    }
}
