package com.jay.underwriter.layer1_data;

/**
 * Failure talking to the record store. {@code retryable} marks transient
 * failures (transport errors, 5xx, 429) that are worth another attempt.
 */
public class RecordStoreException extends RuntimeException {

    private final boolean retryable;

    public RecordStoreException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RecordStoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
