package com.saga.engine.registry;

import com.saga.core.exception.SagaValidationException;
import com.saga.core.exception.UnregisteredSagaTypeException;
import com.saga.core.model.SagaOptions;
import com.saga.core.model.SagaRegistration;
import com.saga.core.model.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Saga type to registered steps and options.
 * Owned by one orchestrator; registering a type again replaces it for sagas started afterwards.
 */
public class SagaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SagaRegistry.class);

    private final Map<String, SagaRegistration> registrations = new ConcurrentHashMap<>();

    /**
     * Register or replace a saga type.
     *
     * @param registration The saga type, its ordered steps and options
     * @return The previous registration, if one was replaced
     * @throws SagaValidationException if the registration is invalid
     */
    public Optional<SagaRegistration> register(SagaRegistration registration) {
        validate(registration);

        SagaRegistration previous = registrations.put(registration.sagaType(), registration);
        if (previous != null) {
            log.info("Replaced saga type {} ({} steps)", registration.sagaType(), registration.steps().size());
        } else {
            log.info("Registered saga type {} ({} steps)", registration.sagaType(), registration.steps().size());
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Look up a saga type.
     *
     * @throws UnregisteredSagaTypeException if the type was never registered
     */
    public SagaRegistration require(String sagaType) {
        SagaRegistration registration = registrations.get(sagaType);
        if (registration == null) {
            throw new UnregisteredSagaTypeException(sagaType);
        }
        return registration;
    }

    public Optional<SagaRegistration> find(String sagaType) {
        return Optional.ofNullable(registrations.get(sagaType));
    }

    public boolean isRegistered(String sagaType) {
        return registrations.containsKey(sagaType);
    }

    /**
     * Registered saga types in alphabetical order.
     */
    public Set<String> registeredTypes() {
        return new TreeSet<>(registrations.keySet());
    }

    private void validate(SagaRegistration registration) {
        if (registration.sagaType() == null || registration.sagaType().isBlank()) {
            throw new SagaValidationException("sagaType", "cannot be empty");
        }
        if (registration.steps().isEmpty()) {
            throw new SagaValidationException("steps", "cannot be empty");
        }

        Set<String> names = new HashSet<>();
        for (StepDefinition step : registration.steps()) {
            if (step.name() == null || step.name().isBlank()) {
                throw new SagaValidationException("steps.name", "cannot be empty");
            }
            if (step.handler() == null) {
                throw new SagaValidationException("steps." + step.name() + ".handler", "cannot be null");
            }
            if (step.timeout() != null && !isPositive(step.timeout())) {
                throw new SagaValidationException("steps." + step.name() + ".timeout", "must be positive");
            }
            if (step.maxRetries() != null && step.maxRetries() < 0) {
                throw new SagaValidationException("steps." + step.name() + ".maxRetries", "cannot be negative");
            }
            if (!names.add(step.name())) {
                // Outputs are keyed by name, so the later step shadows the earlier one
                log.warn("Saga type {} has duplicate step name {}", registration.sagaType(), step.name());
            }
        }

        SagaOptions options = registration.options();
        if (options.maxRetries() != null && options.maxRetries() < 0) {
            throw new SagaValidationException("options.maxRetries", "cannot be negative");
        }
        if (options.retryDelay() != null && options.retryDelay().isNegative()) {
            throw new SagaValidationException("options.retryDelay", "cannot be negative");
        }
        if (options.timeout() != null && !isPositive(options.timeout())) {
            throw new SagaValidationException("options.timeout", "must be positive");
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
