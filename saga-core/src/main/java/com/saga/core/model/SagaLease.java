package com.saga.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Distributed lock guarding the execution of one saga instance.
 * Ensures a saga is never driven by two orchestrators at the same time.
 *
 * Primary Key: leaseKey
 *
 * Invariants:
 * - Only one active lease per leaseKey
 * - fenceToken increases on every forced release
 * - Lease expires automatically if not renewed
 */
public record SagaLease(
    // Primary key: saga:{sagaId}
    String leaseKey,

    // Ownership
    UUID holderId,
    String holderAddress,

    // Timing
    Instant acquiredAt,
    Instant expiresAt,
    Duration leaseDuration,
    int renewalCount,

    // Fencing
    long fenceToken
) {
    /**
     * Default lease duration: 5 minutes.
     */
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofMinutes(5);

    private static final String KEY_PREFIX = "saga:";

    /**
     * Create a lease key for a saga instance.
     */
    public static String leaseKeyFor(String sagaId) {
        return KEY_PREFIX + sagaId;
    }

    /**
     * Extract the saga id from a lease key, or null if the key is not a saga lease.
     */
    public static String sagaIdOf(String leaseKey) {
        return leaseKey.startsWith(KEY_PREFIX) ? leaseKey.substring(KEY_PREFIX.length()) : null;
    }

    /**
     * Create a new lease starting at {@code now}.
     */
    public static SagaLease create(
            String sagaId,
            UUID holderId,
            String holderAddress,
            Duration duration,
            long fenceToken,
            Instant now) {
        return new SagaLease(
            leaseKeyFor(sagaId),
            holderId,
            holderAddress,
            now,
            now.plus(duration),
            duration,
            0,
            fenceToken
        );
    }

    /**
     * Check if the lease is still valid at the given time.
     */
    public boolean isValidAt(Instant now) {
        return expiresAt.isAfter(now);
    }

    /**
     * Check if the lease has expired at the given time.
     */
    public boolean isExpiredAt(Instant now) {
        return !isValidAt(now);
    }

    /**
     * Get the remaining time on this lease.
     */
    public Duration remainingTime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Create a renewed lease with extended expiration.
     */
    public SagaLease renew(Instant now) {
        return new SagaLease(
            leaseKey,
            holderId,
            holderAddress,
            acquiredAt,
            now.plus(leaseDuration),
            leaseDuration,
            renewalCount + 1,
            fenceToken
        );
    }

    /**
     * Check if this lease can be acquired by the given holder.
     * A lease can be acquired if:
     * 1. No current holder (new lease)
     * 2. Current holder is the same (renewal)
     * 3. Current lease is expired (takeover)
     */
    public boolean canBeAcquiredBy(UUID requestingHolder, Instant now) {
        if (holderId == null) {
            return true;
        }
        if (holderId.equals(requestingHolder)) {
            return true;
        }
        return isExpiredAt(now);
    }
}
