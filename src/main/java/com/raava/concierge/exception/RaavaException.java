package com.raava.concierge.exception;

/**
 * Base class for infrastructure and business-rule failures that reach the caller.
 * Conversational misses (nothing extracted, fields still missing) are never exceptions.
 */
public class RaavaException extends RuntimeException {

    private final RaavaErrorCode errorCode;
    private final boolean retryable;

    public RaavaException(RaavaErrorCode errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public RaavaException(RaavaErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public RaavaErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
