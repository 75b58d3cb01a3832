package com.ivamare.eventstore.exception;

/**
 * Raised when an operation is attempted with a canceled or expired context.
 */
public class OperationCanceledException extends EventStoreException {

    private final boolean deadlineExceeded;

    public OperationCanceledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
