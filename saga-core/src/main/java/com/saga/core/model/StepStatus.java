package com.saga.core.model;

/**
 * Lifecycle states for a single step of a saga.
 */
public enum StepStatus {
    /**
     * Step not entered yet.
     * Transitions: -> RUNNING
     */
    PENDING,

    /**
     * Step handler invoked, outcome unknown until it returns.
     * Transitions: -> COMPLETED, FAILED
     */
    RUNNING,

    /**
     * Forward action succeeded.
     * Transitions: -> COMPENSATING
     */
    COMPLETED,

    /**
     * Forward action failed or timed out.
     * Transitions: -> RUNNING (retry)
     */
    FAILED,

    /**
     * Compensation invoked. A step left here after the saga finished had its compensation fail.
     * Transitions: -> COMPENSATED
     */
    COMPENSATING,

    /**
     * Compensation succeeded. Terminal state.
     */
    COMPENSATED;

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(StepStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED;
            case COMPLETED -> target == COMPENSATING;
            case FAILED -> target == RUNNING;
            case COMPENSATING -> target == COMPENSATED;
            case COMPENSATED -> false;
        };
    }
}
