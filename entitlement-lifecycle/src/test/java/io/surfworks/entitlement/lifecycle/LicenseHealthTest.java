package io.surfworks.entitlement.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LicenseHealth}.
 */
class LicenseHealthTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private static LicenseState state(LicenseStatus status, Instant graceUntil) {
        LicenseState state = new LicenseState("LIC-1");
        state.setStatus(status);
        state.setGraceUntil(graceUntil);
        state.setReason("because");
        return state;
    }

    @Test
    @DisplayName("confirmed states are ok")
    void of_confirmed_ok() {
        assertTrue(LicenseHealth.of(state(LicenseStatus.ACTIVE, null), NOW).ok());
        assertTrue(LicenseHealth.of(state(LicenseStatus.VALIDATED, null), NOW).ok());
    }

    @Test
    @DisplayName("EXPIRED is ok only while the marker is in the future")
    void of_expired_dependsOnMarker() {
        assertTrue(LicenseHealth.of(state(LicenseStatus.EXPIRED, NOW.plus(Duration.ofHours(1))), NOW).ok());
        assertFalse(LicenseHealth.of(state(LicenseStatus.EXPIRED, NOW), NOW).ok());
        assertFalse(LicenseHealth.of(state(LicenseStatus.EXPIRED, null), NOW).ok());
    }

    @Test
    @DisplayName("degraded and inactive states are not ok")
    void of_otherStates_notOk() {
        for (LicenseStatus status : new LicenseStatus[] {
                LicenseStatus.UNCONFIGURED, LicenseStatus.DEACTIVATED, LicenseStatus.REVOKED,
                LicenseStatus.GRACE_SOFT, LicenseStatus.LOCK_HARD}) {
            assertFalse(LicenseHealth.of(state(status, NOW.plus(Duration.ofHours(1))), NOW).ok(), status.name());
        }
    }

    @Test
    @DisplayName("summary copies the record fields")
    void of_copiesFields() {
        LicenseHealth health = LicenseHealth.of(state(LicenseStatus.LOCK_HARD, NOW), NOW);

        assertEquals(LicenseStatus.LOCK_HARD, health.status());
        assertEquals(NOW, health.graceUntil());
        assertEquals("because", health.reason());
        assertNull(health.lastValidated());
    }
}
