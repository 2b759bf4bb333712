package com.saga.engine.persistence;

import com.saga.core.model.SagaLease;
import com.saga.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemorySagaLeaseStoreTest {

    private static final Duration LEASE = Duration.ofMinutes(5);

    private final UUID holderA = UUID.randomUUID();
    private final UUID holderB = UUID.randomUUID();

    private TimeController time;
    private InMemorySagaLeaseStore store;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        store = new InMemorySagaLeaseStore(time);
    }

    private SagaLease lease(String sagaId, UUID holder) {
        String key = SagaLease.leaseKeyFor(sagaId);
        return SagaLease.create(sagaId, holder, "node", LEASE, store.getFenceToken(key), time.instant());
    }

    @Test
    @DisplayName("Only one holder at a time until the lease expires")
    void exclusiveUntilExpiry() {
        assertThat(store.tryAcquire(lease("s-1", holderA))).isTrue();
        assertThat(store.tryAcquire(lease("s-1", holderB))).isFalse();

        time.advance(LEASE.plusSeconds(1));

        assertThat(store.tryAcquire(lease("s-1", holderB))).isTrue();
        assertThat(store.findByKey(SagaLease.leaseKeyFor("s-1")).orElseThrow().holderId()).isEqualTo(holderB);
    }

    @Test
    @DisplayName("Renewal extends the lease for its holder only")
    void renew() {
        store.tryAcquire(lease("s-1", holderA));
        String key = SagaLease.leaseKeyFor("s-1");
        time.advanceMinutes(4);

        assertThat(store.renew(key, holderB, time.instant().plus(LEASE))).isFalse();
        assertThat(store.renew(key, holderA, time.instant().plus(LEASE))).isTrue();

        time.advanceMinutes(4);
        assertThat(store.tryAcquire(lease("s-1", holderB))).isFalse();
        assertThat(store.findByKey(key).orElseThrow().renewalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An expired lease cannot be renewed")
    void renewAfterExpiry() {
        store.tryAcquire(lease("s-1", holderA));
        time.advance(LEASE.plusSeconds(1));

        assertThat(store.renew(SagaLease.leaseKeyFor("s-1"), holderA, time.instant().plus(LEASE))).isFalse();
    }

    @Test
    @DisplayName("Release frees the lease; other holders cannot release it")
    void release() {
        store.tryAcquire(lease("s-1", holderA));
        String key = SagaLease.leaseKeyFor("s-1");

        assertThat(store.release(key, holderB)).isFalse();
        assertThat(store.release(key, holderA)).isTrue();
        assertThat(store.findByKey(key)).isEmpty();
        assertThat(store.tryAcquire(lease("s-1", holderB))).isTrue();
    }

    @Test
    @DisplayName("Forced release bumps the fence token and invalidates the old holder")
    void forceRelease() {
        store.tryAcquire(lease("s-1", holderA));
        String key = SagaLease.leaseKeyFor("s-1");

        long token = store.forceRelease(key);

        assertThat(token).isEqualTo(1);
        assertThat(store.validateFenceToken(key, 0)).isFalse();
        assertThat(store.validateFenceToken(key, 1)).isTrue();
        assertThat(store.renew(key, holderA, time.instant().plus(LEASE))).isFalse();

        SagaLease takeover = lease("s-1", holderB);
        assertThat(takeover.fenceToken()).isEqualTo(1);
        assertThat(store.tryAcquire(takeover)).isTrue();
    }

    @Test
    @DisplayName("Holder and expiry queries")
    void queries() {
        store.tryAcquire(lease("s-1", holderA));
        store.tryAcquire(lease("s-2", holderA));
        time.advanceMinutes(3);
        store.tryAcquire(lease("s-3", holderB));

        assertThat(store.findByHolder(holderA)).hasSize(2);

        time.advanceMinutes(3);
        assertThat(store.findExpired(time.instant(), 10))
            .extracting(SagaLease::leaseKey)
            .containsExactlyInAnyOrder("saga:s-1", "saga:s-2");
        assertThat(store.deleteExpiredBefore(time.instant())).isEqualTo(2);
        assertThat(store.findByHolder(holderA)).isEmpty();
        assertThat(store.findByHolder(holderB)).hasSize(1);
    }
}
