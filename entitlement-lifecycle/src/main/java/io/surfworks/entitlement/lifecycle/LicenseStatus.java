package io.surfworks.entitlement.lifecycle;

import java.util.Locale;

/**
 * Local license status. Exactly one value holds at a time.
 */
public enum LicenseStatus {
    UNCONFIGURED,
    ACTIVE,
    VALIDATED,
    DEACTIVATED,
    EXPIRED,
    REVOKED,
    GRACE_SOFT,
    LOCK_HARD;

    /**
     * Degraded states entered by the grace policy.
     */
    public boolean isGrace() {
        return this == GRACE_SOFT || this == LOCK_HARD;
    }

    /**
     * States confirmed by a successful remote call.
     */
    public boolean isConfirmed() {
        return this == ACTIVE || this == VALIDATED;
    }

    /**
     * Lenient parse for persisted values; unknown or missing maps to UNCONFIGURED.
     */
    public static LicenseStatus fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNCONFIGURED;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNCONFIGURED;
        }
    }
}
