package io.surfworks.entitlement.lifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Degradation applied when a validation call fails.
 *
 * <p>Only the time since the last successful confirmation counts; failures
 * are not accumulated. Up to {@code softHours} (inclusive) and strictly
 * between the two bounds the license is {@link LicenseStatus#GRACE_SOFT};
 * from {@code hardHours} (inclusive) it is {@link LicenseStatus#LOCK_HARD}.
 * A license that was never confirmed starts soft.
 */
public final class GracePolicy {

    private static final Logger LOG = Logger.getLogger(GracePolicy.class.getName());

    public static final double DEFAULT_SOFT_HOURS = 24;
    public static final double DEFAULT_HARD_HOURS = 48;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final double softHours;
    private final double hardHours;

    public GracePolicy() {
        this(DEFAULT_SOFT_HOURS, DEFAULT_HARD_HOURS);
    }

    public GracePolicy(double softHours, double hardHours) {
        if (softHours < 0 || hardHours < softHours) {
            throw new IllegalArgumentException(
                "Require 0 <= softHours <= hardHours, got " + softHours + " and " + hardHours);
        }
        this.softHours = softHours;
        this.hardHours = hardHours;
    }

    public double softHours() {
        return softHours;
    }

    public double hardHours() {
        return hardHours;
    }

    /**
     * Status for a failure observed at {@code now}.
     *
     * @param lastValidated last successful confirmation, or null if never
     */
    public LicenseStatus evaluate(Instant lastValidated, Instant now) {
        if (lastValidated == null) {
            return LicenseStatus.GRACE_SOFT;
        }
        double deltaHours = Duration.between(lastValidated, now).toMillis() / MILLIS_PER_HOUR;
        if (deltaHours <= softHours) {
            return LicenseStatus.GRACE_SOFT;
        }
        if (deltaHours >= hardHours) {
            return LicenseStatus.LOCK_HARD;
        }
        return LicenseStatus.GRACE_SOFT;
    }

    /**
     * Engage the policy on {@code state}.
     *
     * @param reason description of the failure that triggered it
     */
    void apply(LicenseState state, String reason, Instant now) {
        LicenseStatus status = evaluate(state.getLastValidated(), now);
        state.setStatus(status);
        state.setGraceUntil(now);
        state.setReason("Grace policy engaged: " + reason);
        LOG.warning("Grace policy: status=" + status + " lastValidated=" + state.getLastValidated()
            + " graceUntil=" + now);
    }
}
