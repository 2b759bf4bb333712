package com.saga.core.store;

import com.saga.core.model.SagaLease;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for saga leases.
 * Guarantees that a saga instance is driven by at most one orchestrator at a time.
 */
public interface SagaLeaseStore {

    /**
     * Try to acquire a lease.
     *
     * @param lease The lease to acquire
     * @return true if acquired, false if a live lease is held by another orchestrator
     */
    boolean tryAcquire(SagaLease lease);

    /**
     * Renew an existing lease.
     *
     * @param leaseKey The lease key
     * @param holderId The current holder ID
     * @param newExpiresAt New expiration time
     * @return true if renewal succeeded, false if the lease was lost
     */
    boolean renew(String leaseKey, UUID holderId, Instant newExpiresAt);

    /**
     * Release a lease.
     *
     * @param leaseKey The lease key
     * @param holderId The current holder ID
     * @return true if released, false if already released or taken over
     */
    boolean release(String leaseKey, UUID holderId);

    /**
     * Force release a lease (for recovery). Increments the fence token.
     *
     * @param leaseKey The lease key
     * @return The new fence token
     */
    long forceRelease(String leaseKey);

    Optional<SagaLease> findByKey(String leaseKey);

    List<SagaLease> findByHolder(UUID holderId);

    /**
     * Find leases expired at the given time.
     *
     * @param now Current time
     * @param limit Maximum number of results
     * @return Expired leases
     */
    List<SagaLease> findExpired(Instant now, int limit);

    /**
     * Get the current fence token for a lease key (0 if never leased).
     */
    long getFenceToken(String leaseKey);

    /**
     * Check if a fence token is still the current one for a lease key.
     */
    boolean validateFenceToken(String leaseKey, long fenceToken);

    /**
     * Delete leases expired before the given time. Fence tokens are kept.
     *
     * @return Number of deleted leases
     */
    int deleteExpiredBefore(Instant expiredBefore);
}
