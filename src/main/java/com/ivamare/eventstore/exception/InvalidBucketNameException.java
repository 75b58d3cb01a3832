package com.ivamare.eventstore.exception;

/**
 * Raised when a logical bucket name cannot be turned into a safe table name.
 */
public class InvalidBucketNameException extends EventStoreException {

    private final String logicalName;
    private final String tableName;

    public InvalidBucketNameException(String logicalName, String tableName) {
        super("invalid bucket name " + quote(logicalName) + ": derived table name "
            + quote(tableName) + " is not a valid identifier");
        this.logicalName = logicalName;
        this.tableName = tableName;
    }

    public String getLogicalName() {
        return logicalName;
    }

    public String getTableName() {
        return tableName;
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }
}
