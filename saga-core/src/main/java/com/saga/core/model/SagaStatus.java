package com.saga.core.model;

/**
 * Lifecycle states for a saga instance.
 * Transitions follow a strict state machine - see {@link #canTransitionTo(SagaStatus)}.
 */
public enum SagaStatus {
    /**
     * Saga created, no step entered yet.
     * Transitions: -> RUNNING
     */
    PENDING,

    /**
     * Steps are being executed or compensated.
     * Transitions: -> COMPLETED, FAILED
     */
    RUNNING,

    /**
     * Every step completed. Terminal state.
     */
    COMPLETED,

    /**
     * A step failed unrecoverably; completed steps were compensated (best-effort).
     * Can be manually transitioned: -> PENDING
     */
    FAILED;

    /**
     * Check if this status is terminal (no further automatic transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(SagaStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED -> false;
            case FAILED -> target == PENDING;
        };
    }
}
