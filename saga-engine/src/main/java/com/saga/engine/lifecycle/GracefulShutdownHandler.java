package com.saga.engine.lifecycle;

import com.saga.engine.orchestrator.SagaOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;

/**
 * Manages graceful shutdown for the saga orchestrator.
 *
 * On shutdown:
 * 1. Stops accepting new sagas
 * 2. Waits for in-flight sagas to finish (with timeout)
 * 3. Cancels every outstanding step deadline and retry timer
 * 4. Releases all saga leases held by this node
 *
 * Sagas still running when the timeout expires are aborted and left RUNNING
 * for the recovery service.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final SagaOrchestrator orchestrator;
    private final Duration shutdownTimeout;

    public GracefulShutdownHandler(SagaOrchestrator orchestrator, Duration shutdownTimeout) {
        this.orchestrator = orchestrator;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return !orchestrator.isAccepting();
    }

    /**
     * Handle application shutdown event.
     * This runs before the Spring context destroys its beans.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        int active = orchestrator.activeSagaIds().size();
        log.info("Initiating graceful shutdown for {} ({} active sagas, timeout {}s)",
            orchestrator.holderId(), active, shutdownTimeout.toSeconds());

        boolean drained = orchestrator.shutdown(shutdownTimeout);

        if (drained) {
            log.info("Graceful shutdown complete");
        } else {
            log.warn("Graceful shutdown timed out, unfinished sagas are left for recovery");
        }
    }
}
