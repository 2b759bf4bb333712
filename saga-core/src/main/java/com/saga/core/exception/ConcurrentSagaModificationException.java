package com.saga.core.exception;

/**
 * Thrown when a saga record changed between read and write.
 */
public class ConcurrentSagaModificationException extends SagaStoreException {

    public static final String ERROR_CODE = "CONCURRENT_MODIFICATION";

    public ConcurrentSagaModificationException(String sagaId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Saga %s was modified concurrently (expected version %d)",
            sagaId, expectedVersion
        ));
    }
}
