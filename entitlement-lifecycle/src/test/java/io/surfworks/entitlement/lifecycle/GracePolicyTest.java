package io.surfworks.entitlement.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GracePolicy}.
 */
class GracePolicyTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    private final GracePolicy policy = new GracePolicy();

    private LicenseStatus after(Duration sinceLastSuccess) {
        return policy.evaluate(NOW.minus(sinceLastSuccess), NOW);
    }

    @Test
    @DisplayName("never validated starts soft")
    void evaluate_neverValidated_soft() {
        assertEquals(LicenseStatus.GRACE_SOFT, policy.evaluate(null, NOW));
    }

    @Test
    @DisplayName("soft bound is inclusive")
    void evaluate_softBoundary() {
        assertEquals(LicenseStatus.GRACE_SOFT, after(Duration.ZERO));
        assertEquals(LicenseStatus.GRACE_SOFT, after(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("between the bounds stays soft")
    void evaluate_betweenBounds_soft() {
        assertEquals(LicenseStatus.GRACE_SOFT, after(Duration.ofHours(24).plusMinutes(1)));
        assertEquals(LicenseStatus.GRACE_SOFT, after(Duration.ofMinutes(47 * 60 + 30)));
    }

    @Test
    @DisplayName("hard bound is inclusive")
    void evaluate_hardBoundary() {
        assertEquals(LicenseStatus.LOCK_HARD, after(Duration.ofHours(48)));
        assertEquals(LicenseStatus.LOCK_HARD, after(Duration.ofHours(50)));
    }

    @Test
    @DisplayName("custom bounds are honored")
    void evaluate_customBounds() {
        var strict = new GracePolicy(1, 2);

        assertEquals(LicenseStatus.GRACE_SOFT, strict.evaluate(NOW.minus(Duration.ofMinutes(90)), NOW));
        assertEquals(LicenseStatus.LOCK_HARD, strict.evaluate(NOW.minus(Duration.ofHours(3)), NOW));
    }

    @Test
    @DisplayName("invalid bounds are rejected")
    void constructor_invalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new GracePolicy(-1, 48));
        assertThrows(IllegalArgumentException.class, () -> new GracePolicy(48, 24));
    }

    @Test
    @DisplayName("apply sets status, marker and reason")
    void apply_updatesState() {
        LicenseState state = new LicenseState("LIC-1");
        state.setLastValidated(NOW.minus(Duration.ofHours(49)));

        policy.apply(state, "HTTP 500", NOW);

        assertEquals(LicenseStatus.LOCK_HARD, state.getStatus());
        assertEquals(NOW, state.getGraceUntil());
        assertEquals("Grace policy engaged: HTTP 500", state.getReason());
    }
}
