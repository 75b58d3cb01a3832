package com.ivamare.eventstore.exception;

/**
 * Wraps a storage engine failure with the operation and table it came from.
 */
public class StoreOperationException extends EventStoreException {

    private final String operation;
    private final String table;

    public StoreOperationException(String operation, String table, Throwable cause) {
        super(operation + " failed on " + table + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.table = table;
    }

    public String getOperation() {
        return operation;
    }

    public String getTable() {
        return table;
    }
}
