package com.saga.core.exception;

/**
 * Base exception for all saga engine errors.
 */
public class SagaException extends RuntimeException {

    private final String errorCode;

    public SagaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SagaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
