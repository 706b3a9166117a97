package com.raava.concierge.exception;

public class RecordNotFoundException extends RaavaException {

    public RecordNotFoundException(String message) {
        super(RaavaErrorCode.RECORD_NOT_FOUND, message, false);
    }
}
