package com.raava.concierge.exception;

/**
 * Thrown when the text completion service fails, times out or is not configured.
 */
public class TextCompletionException extends RaavaException {

    public TextCompletionException(String message) {
        super(RaavaErrorCode.COMPLETION_FAILURE, message, true);
    }

    public TextCompletionException(String message, Throwable cause) {
        super(RaavaErrorCode.COMPLETION_FAILURE, message, true, cause);
    }
}
