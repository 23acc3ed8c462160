package de.caluga.solo.store;

/**
 * error while reading, writing or deleting a lease record
 * (storage unavailable, quota exceeded, I/O problem...)
 */
public class LeaseStoreException extends Exception {
    private String key;
    private String operation;

    public LeaseStoreException(String message) {
        super(message);
    }

    public LeaseStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public LeaseStoreException(String message, Throwable cause, String operation, String key) {
        super(message, cause);
        this.operation = operation;
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public LeaseStoreException setKey(String key) {
        this.key = key;
        return this;
    }

    public String getOperation() {
        return operation;
    }

    public LeaseStoreException setOperation(String operation) {
        this.operation = operation;
        return this;
    }

    @Override
    public String getMessage() {
        if (operation == null && key == null) {
            return super.getMessage();
        }

        return super.getMessage() + " (operation: " + operation + ", key: " + key + ")";
    }
}
