package com.ivamare.eventstore.exception;

/**
 * Raised when a stored JSON column cannot be decoded.
 *
 * <p>The message always starts with {@code failed to unmarshal <column>}.
 */
public class PayloadDecodingException extends EventStoreException {

    private final String column;

    public PayloadDecodingException(String column, String reason) {
        super("failed to unmarshal " + column + ": " + reason);
        this.column = column;
    }

    public PayloadDecodingException(String column, Throwable cause) {
        super("failed to unmarshal " + column + ": " + cause.getMessage(), cause);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
