package com.saga.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.saga.core.exception.SagaNotFoundException;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepStatus;
import com.saga.core.store.SagaStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SagaStore.
 * Each mutation is applied atomically to the record through {@link ConcurrentHashMap#compute}.
 */
public class InMemorySagaStore implements SagaStore {

    private final Map<String, SagaDefinition> sagas = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySagaStore() {
        this(Clock.systemUTC());
    }

    public InMemorySagaStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(SagaDefinition saga) {
        sagas.put(saga.sagaId(), saga);
    }

    @Override
    public SagaDefinition updateStatus(String sagaId, SagaStatus status, String error) {
        return mutate(sagaId, saga -> saga.withStatus(status, error, clock.instant()));
    }

    @Override
    public SagaDefinition updateStepStatus(String sagaId, String stepName, StepStatus status,
                                           JsonNode result, String error) {
        return mutate(sagaId, saga -> saga.withStepStatus(stepName, status, result, error, clock.instant()));
    }

    @Override
    public SagaDefinition complete(String sagaId, Map<String, JsonNode> result) {
        return mutate(sagaId, saga -> saga.withCompleted(result, clock.instant()));
    }

    @Override
    public SagaDefinition updateRetryCount(String sagaId, int retryCount) {
        return mutate(sagaId, saga -> saga.withRetryCount(retryCount, clock.instant()));
    }

    @Override
    public Optional<SagaDefinition> findById(String sagaId) {
        return Optional.ofNullable(sagas.get(sagaId));
    }

    @Override
    public List<SagaDefinition> findByStatus(SagaStatus status) {
        return findByStatus(status, Integer.MAX_VALUE);
    }

    @Override
    public List<SagaDefinition> findByStatus(SagaStatus status, int limit) {
        return sagas.values().stream()
            .filter(s -> s.status() == status)
            .sorted(Comparator.comparing(SagaDefinition::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<SagaDefinition> findStaleRunning(Instant updatedBefore, int limit) {
        return sagas.values().stream()
            .filter(s -> s.status() == SagaStatus.RUNNING)
            .filter(s -> s.updatedAt().isBefore(updatedBefore))
            .sorted(Comparator.comparing(SagaDefinition::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<SagaStatus, Long> countByStatus() {
        Map<SagaStatus, Long> counts = new EnumMap<>(SagaStatus.class);
        for (SagaStatus status : SagaStatus.values()) {
            counts.put(status, 0L);
        }
        sagas.values().forEach(s -> counts.merge(s.status(), 1L, Long::sum));
        return counts;
    }

    @Override
    public int deleteFinishedBefore(Instant finishedBefore) {
        List<String> toDelete = sagas.values().stream()
            .filter(SagaDefinition::isTerminal)
            .filter(s -> s.updatedAt().isBefore(finishedBefore))
            .map(SagaDefinition::sagaId)
            .collect(Collectors.toList());

        toDelete.forEach(sagas::remove);
        return toDelete.size();
    }

    private SagaDefinition mutate(String sagaId, UnaryOperator<SagaDefinition> change) {
        SagaDefinition updated = sagas.computeIfPresent(sagaId, (id, saga) -> change.apply(saga));
        if (updated == null) {
            throw new SagaNotFoundException("Saga", sagaId);
        }
        return updated;
    }
}
