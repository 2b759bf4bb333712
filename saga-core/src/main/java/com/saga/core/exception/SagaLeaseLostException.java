package com.saga.core.exception;

/**
 * Thrown when the orchestrator loses the lease of a saga it is driving.
 * The run stops without touching the record further.
 */
public class SagaLeaseLostException extends SagaException {

    public static final String ERROR_CODE = "SAGA_LEASE_LOST";

    public SagaLeaseLostException(String sagaId, long fenceToken) {
        super(ERROR_CODE, String.format(
            "Lease for saga %s lost (fence token %d)",
            sagaId, fenceToken
        ));
    }
}
