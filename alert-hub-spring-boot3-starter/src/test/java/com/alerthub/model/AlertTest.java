package com.alerthub.model;

import com.alerthub.model.enums.AlertSeverity;
import com.alerthub.model.enums.AlertState;
import com.alerthub.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AlertTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

    @Test
    void createFillsDefaults() {
        Alert a = Alert.create("x".repeat(600), null, "svc", null, " ", clock);

        assertEquals(Alert.MAX_MESSAGE_LEN, a.getMessage().length());
        assertEquals(AlertSeverity.INFO, a.getSeverity());
        assertEquals(AlertState.ACTIVE, a.getState());
        assertEquals(1, a.getCount());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), a.getTimestamp());
        assertDoesNotThrow(() -> UUID.fromString(a.getCorrelationId()));
        assertTrue(a.hasIdentity());
    }

    @Test
    void transitionsKeepIdentity() {
        Alert a = Alert.create("m", AlertSeverity.ERROR, "svc", null, "cid", clock);
        Instant at = Instant.parse("2024-05-01T11:00:00Z");

        Alert acked = a.acknowledge("alice", at);
        Alert resolved = acked.resolve("bob", at.plusSeconds(60));

        assertEquals(a.getId(), resolved.getId());
        assertTrue(acked.isAcknowledged());
        assertFalse(acked.isResolved());
        assertTrue(resolved.isResolved());
        assertTrue(resolved.isAcknowledged());
        assertEquals("alice", resolved.getAcknowledgedBy());
        assertEquals(at, resolved.getAcknowledgedAt());
        assertEquals("bob", resolved.getResolvedBy());
    }

    @Test
    void nilIdHasNoIdentity() {
        Alert nil = Alert.create("m", AlertSeverity.ERROR, "svc").toBuilder().id(new UUID(0L, 0L)).build();
        Alert missing = Alert.create("m", AlertSeverity.ERROR, "svc").toBuilder().id(null).build();

        assertFalse(nil.hasIdentity());
        assertFalse(missing.hasIdentity());
    }
}
