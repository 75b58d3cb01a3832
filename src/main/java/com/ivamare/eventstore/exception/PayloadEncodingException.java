package com.ivamare.eventstore.exception;

/**
 * Raised when a payload cannot be serialized for storage.
 */
public class PayloadEncodingException extends EventStoreException {

    public PayloadEncodingException(String column, Throwable cause) {
        super("failed to marshal " + column + ": " + cause.getMessage(), cause);
    }
}
