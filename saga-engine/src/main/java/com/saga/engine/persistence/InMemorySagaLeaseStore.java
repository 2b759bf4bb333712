package com.saga.engine.persistence;

import com.saga.core.model.SagaLease;
import com.saga.core.store.SagaLeaseStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SagaLeaseStore.
 * Only coordinates orchestrators running in the same JVM.
 */
public class InMemorySagaLeaseStore implements SagaLeaseStore {

    private final Map<String, SagaLease> leases = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> fenceTokens = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySagaLeaseStore() {
        this(Clock.systemUTC());
    }

    public InMemorySagaLeaseStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(SagaLease lease) {
        synchronized (leases) {
            SagaLease existing = leases.get(lease.leaseKey());
            if (existing != null && !existing.canBeAcquiredBy(lease.holderId(), clock.instant())) {
                return false;
            }

            leases.put(lease.leaseKey(), lease);
            fenceTokens.computeIfAbsent(lease.leaseKey(), k -> new AtomicLong(0))
                .set(lease.fenceToken());
            return true;
        }
    }

    @Override
    public boolean renew(String leaseKey, UUID holderId, Instant newExpiresAt) {
        synchronized (leases) {
            SagaLease existing = leases.get(leaseKey);
            if (existing == null || !existing.holderId().equals(holderId)) {
                return false;
            }
            if (existing.isExpiredAt(clock.instant())) {
                return false;
            }

            leases.put(leaseKey, new SagaLease(
                existing.leaseKey(),
                existing.holderId(),
                existing.holderAddress(),
                existing.acquiredAt(),
                newExpiresAt,
                existing.leaseDuration(),
                existing.renewalCount() + 1,
                existing.fenceToken()
            ));
            return true;
        }
    }

    @Override
    public boolean release(String leaseKey, UUID holderId) {
        synchronized (leases) {
            SagaLease existing = leases.get(leaseKey);
            if (existing == null || !existing.holderId().equals(holderId)) {
                return false;
            }
            leases.remove(leaseKey);
            return true;
        }
    }

    @Override
    public long forceRelease(String leaseKey) {
        synchronized (leases) {
            leases.remove(leaseKey);
            return fenceTokens
                .computeIfAbsent(leaseKey, k -> new AtomicLong(0))
                .incrementAndGet();
        }
    }

    @Override
    public Optional<SagaLease> findByKey(String leaseKey) {
        return Optional.ofNullable(leases.get(leaseKey));
    }

    @Override
    public List<SagaLease> findByHolder(UUID holderId) {
        return leases.values().stream()
            .filter(l -> l.holderId().equals(holderId))
            .collect(Collectors.toList());
    }

    @Override
    public List<SagaLease> findExpired(Instant now, int limit) {
        return leases.values().stream()
            .filter(l -> l.isExpiredAt(now))
            .sorted(Comparator.comparing(SagaLease::expiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long getFenceToken(String leaseKey) {
        AtomicLong token = fenceTokens.get(leaseKey);
        return token != null ? token.get() : 0;
    }

    @Override
    public boolean validateFenceToken(String leaseKey, long fenceToken) {
        return getFenceToken(leaseKey) == fenceToken;
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        synchronized (leases) {
            List<String> toRemove = leases.entrySet().stream()
                .filter(e -> e.getValue().expiresAt().isBefore(expiredBefore))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

            toRemove.forEach(leases::remove);
            return toRemove.size();
        }
    }
}
