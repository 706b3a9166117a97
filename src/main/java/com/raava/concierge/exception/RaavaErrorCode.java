package com.raava.concierge.exception;

/**
 * Error codes surfaced to API callers.
 */
public enum RaavaErrorCode {
    PERSISTENCE_FAILURE,
    COMPLETION_FAILURE,
    RECORD_NOT_FOUND,
    INVALID_STATUS_TRANSITION
}
