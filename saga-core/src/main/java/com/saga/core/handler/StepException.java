package com.saga.core.handler;

/**
 * Exception thrown by step handlers on failure.
 * A non-retryable StepException skips the retry budget and goes straight to compensation.
 */
public class StepException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public StepException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public StepException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StepException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static StepException permanent(String errorCode, String message) {
        return new StepException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static StepException transientFailure(String errorCode, String message) {
        return new StepException(errorCode, message, true);
    }
}
