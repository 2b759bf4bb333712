package com.saga.core.handler;

import java.time.Duration;

/**
 * Synthetic failure raised when a step handler does not finish before its deadline.
 * Handled exactly like a thrown handler error.
 */
public class StepTimeoutException extends StepException {

    public static final String ERROR_CODE = "STEP_TIMEOUT";

    private final Duration timeout;

    public StepTimeoutException(String stepName, Duration timeout) {
        super(ERROR_CODE, "Step " + stepName + " timeout", true);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
