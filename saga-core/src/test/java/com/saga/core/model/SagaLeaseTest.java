package com.saga.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SagaLeaseTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void create_shouldSetCorrectDefaults() {
        UUID holderId = UUID.randomUUID();

        SagaLease lease = SagaLease.create("s-1", holderId, "orchestrator-1", Duration.ofSeconds(30), 1L, NOW);

        assertEquals("saga:s-1", lease.leaseKey());
        assertEquals(holderId, lease.holderId());
        assertEquals(1L, lease.fenceToken());
        assertEquals(0, lease.renewalCount());
        assertEquals(NOW.plusSeconds(30), lease.expiresAt());
        assertTrue(lease.isValidAt(NOW));
    }

    @Test
    void leaseKey_shouldRoundTripSagaId() {
        assertEquals("s-1", SagaLease.sagaIdOf(SagaLease.leaseKeyFor("s-1")));
        assertNull(SagaLease.sagaIdOf("workflow:s-1"));
    }

    @Test
    void isValidAt_shouldReturnFalseAtExpiry() {
        SagaLease lease = SagaLease.create("s-1", UUID.randomUUID(), "o", Duration.ofSeconds(30), 1L, NOW);

        assertFalse(lease.isValidAt(NOW.plusSeconds(30)));
        assertTrue(lease.isExpiredAt(NOW.plusSeconds(31)));
        assertEquals(Duration.ZERO, lease.remainingTime(NOW.plusSeconds(60)));
    }

    @Test
    void renew_shouldExtendExpirationAndKeepFenceToken() {
        SagaLease lease = SagaLease.create("s-1", UUID.randomUUID(), "o", Duration.ofSeconds(30), 7L, NOW);

        SagaLease renewed = lease.renew(NOW.plusSeconds(20));

        assertEquals(1, renewed.renewalCount());
        assertEquals(NOW.plusSeconds(50), renewed.expiresAt());
        assertEquals(NOW, renewed.acquiredAt());
        assertEquals(7L, renewed.fenceToken());
    }

    @Test
    void canBeAcquiredBy_shouldAllowSameHolderOrExpiredTakeover() {
        UUID holder = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        SagaLease lease = SagaLease.create("s-1", holder, "o", Duration.ofSeconds(30), 1L, NOW);

        assertTrue(lease.canBeAcquiredBy(holder, NOW));
        assertFalse(lease.canBeAcquiredBy(other, NOW.plusSeconds(10)));
        assertTrue(lease.canBeAcquiredBy(other, NOW.plusSeconds(31)));
    }
}
