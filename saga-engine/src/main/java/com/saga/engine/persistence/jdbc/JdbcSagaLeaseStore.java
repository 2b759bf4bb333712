package com.saga.engine.persistence.jdbc;

import com.saga.core.model.SagaLease;
import com.saga.core.store.SagaLeaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of SagaLeaseStore.
 *
 * The fence token survives release so that an orchestrator which lost its lease
 * (but doesn't know it yet) can be detected after a forced takeover.
 * Expiry is judged against database time.
 */
public class JdbcSagaLeaseStore implements SagaLeaseStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSagaLeaseStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final SagaLeaseRowMapper rowMapper = new SagaLeaseRowMapper();

    public JdbcSagaLeaseStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean tryAcquire(SagaLease lease) {
        // Insert, or take over only if the current lease is released, expired or already ours
        String sql = """
            INSERT INTO saga_leases (
                lease_key, holder_id, holder_address,
                acquired_at, expires_at, lease_duration_ms,
                renewal_count, fence_token
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (lease_key) DO UPDATE SET
                holder_id = EXCLUDED.holder_id,
                holder_address = EXCLUDED.holder_address,
                acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at,
                lease_duration_ms = EXCLUDED.lease_duration_ms,
                renewal_count = 0
            WHERE saga_leases.holder_id IS NULL
               OR saga_leases.expires_at < NOW()
               OR saga_leases.holder_id = EXCLUDED.holder_id
            RETURNING fence_token
            """;

        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1),
            lease.leaseKey(),
            lease.holderId(),
            lease.holderAddress(),
            Timestamp.from(lease.acquiredAt()),
            Timestamp.from(lease.expiresAt()),
            lease.leaseDuration().toMillis(),
            lease.renewalCount(),
            lease.fenceToken()
        );

        if (tokens.isEmpty()) {
            log.debug("Lease {} is held by another orchestrator", lease.leaseKey());
            return false;
        }
        log.debug("Acquired lease {} with fence token {}", lease.leaseKey(), tokens.get(0));
        return true;
    }

    @Override
    public boolean renew(String leaseKey, UUID holderId, Instant newExpiresAt) {
        String sql = """
            UPDATE saga_leases SET
                expires_at = ?,
                renewal_count = renewal_count + 1
            WHERE lease_key = ? AND holder_id = ? AND expires_at > NOW()
            """;

        int rows = jdbcTemplate.update(sql, Timestamp.from(newExpiresAt), leaseKey, holderId);

        if (rows > 0) {
            log.debug("Renewed lease {} for holder {}", leaseKey, holderId);
            return true;
        }
        log.warn("Failed to renew lease {} for holder {} - lease expired or holder mismatch",
            leaseKey, holderId);
        return false;
    }

    @Override
    public boolean release(String leaseKey, UUID holderId) {
        String sql = """
            UPDATE saga_leases SET
                holder_id = NULL,
                expires_at = NOW()
            WHERE lease_key = ? AND holder_id = ?
            """;

        int rows = jdbcTemplate.update(sql, leaseKey, holderId);
        if (rows > 0) {
            log.debug("Released lease {} by holder {}", leaseKey, holderId);
            return true;
        }
        log.debug("Lease {} not held by {} or already released", leaseKey, holderId);
        return false;
    }

    @Override
    public long forceRelease(String leaseKey) {
        // Bump the fence token so a zombie holder's writes can be rejected
        String sql = """
            INSERT INTO saga_leases (
                lease_key, holder_id, holder_address,
                acquired_at, expires_at, lease_duration_ms,
                renewal_count, fence_token
            ) VALUES (?, NULL, NULL, NOW(), NOW(), 0, 0, 1)
            ON CONFLICT (lease_key) DO UPDATE SET
                holder_id = NULL,
                expires_at = NOW(),
                fence_token = saga_leases.fence_token + 1
            RETURNING fence_token
            """;

        Long newFenceToken = jdbcTemplate.queryForObject(sql, Long.class, leaseKey);
        log.info("Force released lease {} with new fence token {}", leaseKey, newFenceToken);
        return newFenceToken != null ? newFenceToken : 0L;
    }

    @Override
    public Optional<SagaLease> findByKey(String leaseKey) {
        String sql = "SELECT * FROM saga_leases WHERE lease_key = ? AND holder_id IS NOT NULL";
        List<SagaLease> results = jdbcTemplate.query(sql, rowMapper, leaseKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<SagaLease> findByHolder(UUID holderId) {
        String sql = "SELECT * FROM saga_leases WHERE holder_id = ?";
        return jdbcTemplate.query(sql, rowMapper, holderId);
    }

    @Override
    public List<SagaLease> findExpired(Instant now, int limit) {
        String sql = """
            SELECT * FROM saga_leases
            WHERE expires_at <= ? AND holder_id IS NOT NULL
            ORDER BY expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    public long getFenceToken(String leaseKey) {
        String sql = "SELECT fence_token FROM saga_leases WHERE lease_key = ?";
        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1), leaseKey);
        return tokens.isEmpty() ? 0L : tokens.get(0);
    }

    @Override
    public boolean validateFenceToken(String leaseKey, long fenceToken) {
        return getFenceToken(leaseKey) == fenceToken;
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        // Rows keep their fence token; expired leases are detached from their holder
        String sql = """
            UPDATE saga_leases SET holder_id = NULL
            WHERE expires_at < ? AND holder_id IS NOT NULL
            """;
        return jdbcTemplate.update(sql, Timestamp.from(expiredBefore));
    }

    private static class SagaLeaseRowMapper implements RowMapper<SagaLease> {
        @Override
        public SagaLease mapRow(ResultSet rs, int rowNum) throws SQLException {
            String holderId = rs.getString("holder_id");
            Timestamp acquiredAt = rs.getTimestamp("acquired_at");
            Timestamp expiresAt = rs.getTimestamp("expires_at");

            return new SagaLease(
                rs.getString("lease_key"),
                holderId != null ? UUID.fromString(holderId) : null,
                rs.getString("holder_address"),
                acquiredAt != null ? acquiredAt.toInstant() : null,
                expiresAt != null ? expiresAt.toInstant() : null,
                Duration.ofMillis(rs.getLong("lease_duration_ms")),
                rs.getInt("renewal_count"),
                rs.getLong("fence_token")
            );
        }
    }
}
