package io.surfworks.entitlement.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * The durable license record. Mutated only by {@link LicenseController};
 * request gating reads {@link #getStatus()} and {@link #getGraceUntil()}.
 */
public final class LicenseState {

    private String licenseKey = "";
    private LicenseStatus status = LicenseStatus.UNCONFIGURED;
    private String activationToken = "";
    private Instant expiresAt;
    private Instant graceUntil;
    private String reason = "";
    private Instant lastValidated;
    private String lastResponseRaw;
    private String lastErrorRaw;

    public LicenseState() {
    }

    public LicenseState(String licenseKey) {
        setLicenseKey(licenseKey);
    }

    public LicenseState copy() {
        LicenseState copy = new LicenseState();
        copy.licenseKey = licenseKey;
        copy.status = status;
        copy.activationToken = activationToken;
        copy.expiresAt = expiresAt;
        copy.graceUntil = graceUntil;
        copy.reason = reason;
        copy.lastValidated = lastValidated;
        copy.lastResponseRaw = lastResponseRaw;
        copy.lastErrorRaw = lastErrorRaw;
        return copy;
    }

    public String getLicenseKey() {
        return licenseKey;
    }

    public void setLicenseKey(String licenseKey) {
        this.licenseKey = licenseKey != null ? licenseKey.trim() : "";
    }

    public LicenseStatus getStatus() {
        return status;
    }

    public void setStatus(LicenseStatus status) {
        this.status = Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * Activation token held locally; empty when none.
     */
    public String getActivationToken() {
        return activationToken;
    }

    public void setActivationToken(String activationToken) {
        this.activationToken = activationToken != null ? activationToken.trim() : "";
    }

    public boolean hasActivationToken() {
        return !activationToken.isEmpty();
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getGraceUntil() {
        return graceUntil;
    }

    public void setGraceUntil(Instant graceUntil) {
        this.graceUntil = graceUntil;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason != null ? reason : "";
    }

    /**
     * Time of the last successful remote confirmation.
     */
    public Instant getLastValidated() {
        return lastValidated;
    }

    public void setLastValidated(Instant lastValidated) {
        this.lastValidated = lastValidated;
    }

    public String getLastResponseRaw() {
        return lastResponseRaw;
    }

    public void setLastResponseRaw(String lastResponseRaw) {
        this.lastResponseRaw = lastResponseRaw;
    }

    public String getLastErrorRaw() {
        return lastErrorRaw;
    }

    public void setLastErrorRaw(String lastErrorRaw) {
        this.lastErrorRaw = lastErrorRaw;
    }

    @Override
    public String toString() {
        return "LicenseState[status=" + status
            + ", expiresAt=" + expiresAt
            + ", graceUntil=" + graceUntil
            + ", lastValidated=" + lastValidated
            + ", reason=" + reason + "]";
    }
}
