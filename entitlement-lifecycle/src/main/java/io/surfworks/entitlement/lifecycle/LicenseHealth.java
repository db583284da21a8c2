package io.surfworks.entitlement.lifecycle;

import java.time.Instant;

/**
 * Status summary for health endpoints.
 *
 * @param status        current status
 * @param graceUntil    grace marker (may be null)
 * @param reason        reason for the last transition
 * @param lastValidated last successful confirmation (may be null)
 * @param ok            whether the license currently counts as usable
 */
public record LicenseHealth(
    LicenseStatus status,
    Instant graceUntil,
    String reason,
    Instant lastValidated,
    boolean ok
) {

    /**
     * Summarize a record. ACTIVE and VALIDATED are usable; EXPIRED is usable
     * only while its grace marker lies in the future.
     */
    public static LicenseHealth of(LicenseState state, Instant now) {
        LicenseStatus status = state.getStatus();
        boolean graceActive = state.getGraceUntil() != null && state.getGraceUntil().isAfter(now);
        boolean ok = status.isConfirmed() || (status == LicenseStatus.EXPIRED && graceActive);
        return new LicenseHealth(status, state.getGraceUntil(), state.getReason(), state.getLastValidated(), ok);
    }
}
