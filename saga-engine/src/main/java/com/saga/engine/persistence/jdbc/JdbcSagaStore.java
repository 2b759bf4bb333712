package com.saga.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saga.core.exception.ConcurrentSagaModificationException;
import com.saga.core.exception.SagaNotFoundException;
import com.saga.core.exception.SagaStoreException;
import com.saga.core.model.SagaDefinition;
import com.saga.core.model.SagaStatus;
import com.saga.core.model.StepStatus;
import com.saga.core.store.SagaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed implementation of SagaStore.
 * Each saga is one row holding the full record as a JSONB document, plus the columns
 * needed for queries. Mutations are compare-and-set on the version column.
 */
public class JdbcSagaStore implements SagaStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSagaStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<SagaDefinition> rowMapper;

    public JdbcSagaStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rowMapper = (rs, rowNum) -> fromJson(rs.getString("document"));
    }

    @Override
    public void save(SagaDefinition saga) {
        String sql = """
            INSERT INTO sagas (
                saga_id, saga_type, status, retried_from,
                document, created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (saga_id) DO UPDATE SET
                status = EXCLUDED.status,
                document = EXCLUDED.document,
                updated_at = EXCLUDED.updated_at,
                version = EXCLUDED.version
            """;

        run(() -> jdbcTemplate.update(sql,
            saga.sagaId(),
            saga.sagaType(),
            saga.status().name(),
            saga.retriedFrom(),
            toJson(saga),
            Timestamp.from(saga.createdAt()),
            Timestamp.from(saga.updatedAt()),
            saga.version()
        ), "save saga " + saga.sagaId());
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
        String sql = "SELECT document FROM sagas WHERE saga_id = ?";
        List<SagaDefinition> results = run(() -> jdbcTemplate.query(sql, rowMapper, sagaId),
            "load saga " + sagaId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<SagaDefinition> findByStatus(SagaStatus status) {
        String sql = "SELECT document FROM sagas WHERE status = ? ORDER BY created_at";
        return run(() -> jdbcTemplate.query(sql, rowMapper, status.name()),
            "query sagas in " + status);
    }

    @Override
    public List<SagaDefinition> findByStatus(SagaStatus status, int limit) {
        String sql = "SELECT document FROM sagas WHERE status = ? ORDER BY created_at LIMIT ?";
        return run(() -> jdbcTemplate.query(sql, rowMapper, status.name(), limit),
            "query sagas in " + status);
    }

    @Override
    public List<SagaDefinition> findStaleRunning(Instant updatedBefore, int limit) {
        String sql = """
            SELECT document FROM sagas
            WHERE status = 'RUNNING' AND updated_at < ?
            ORDER BY updated_at
            LIMIT ?
            """;
        return run(() -> jdbcTemplate.query(sql, rowMapper, Timestamp.from(updatedBefore), limit),
            "query stale sagas");
    }

    @Override
    public Map<SagaStatus, Long> countByStatus() {
        Map<SagaStatus, Long> counts = new EnumMap<>(SagaStatus.class);
        for (SagaStatus status : SagaStatus.values()) {
            counts.put(status, 0L);
        }
        String sql = "SELECT status, COUNT(*) AS cnt FROM sagas GROUP BY status";
        run(() -> {
            jdbcTemplate.query(sql, rs -> {
                counts.put(SagaStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
            });
            return null;
        }, "count sagas");
        return counts;
    }

    @Override
    public int deleteFinishedBefore(Instant finishedBefore) {
        String sql = """
            DELETE FROM sagas
            WHERE status IN ('COMPLETED', 'FAILED') AND updated_at < ?
            """;
        int deleted = run(() -> jdbcTemplate.update(sql, Timestamp.from(finishedBefore)),
            "delete finished sagas");
        if (deleted > 0) {
            log.info("Deleted {} finished sagas older than {}", deleted, finishedBefore);
        }
        return deleted;
    }

    private SagaDefinition mutate(String sagaId, UnaryOperator<SagaDefinition> change) {
        SagaDefinition current = findById(sagaId)
            .orElseThrow(() -> new SagaNotFoundException("Saga", sagaId));
        SagaDefinition updated = change.apply(current);

        String sql = """
            UPDATE sagas SET
                status = ?,
                document = ?::jsonb,
                updated_at = ?,
                version = ?
            WHERE saga_id = ? AND version = ?
            """;

        int rows = run(() -> jdbcTemplate.update(sql,
            updated.status().name(),
            toJson(updated),
            Timestamp.from(updated.updatedAt()),
            updated.version(),
            sagaId,
            current.version()
        ), "update saga " + sagaId);

        if (rows == 0) {
            throw new ConcurrentSagaModificationException(sagaId, current.version());
        }
        return updated;
    }

    private <T> T run(Supplier<T> operation, String description) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new SagaStoreException("Failed to " + description, e);
        }
    }

    private String toJson(SagaDefinition saga) {
        try {
            return objectMapper.writeValueAsString(saga);
        } catch (JsonProcessingException e) {
            throw new SagaStoreException("Failed to serialize saga " + saga.sagaId(), e);
        }
    }

    private SagaDefinition fromJson(String json) {
        try {
            return objectMapper.readValue(json, SagaDefinition.class);
        } catch (JsonProcessingException e) {
            throw new SagaStoreException("Failed to deserialize saga document", e);
        }
    }
}
