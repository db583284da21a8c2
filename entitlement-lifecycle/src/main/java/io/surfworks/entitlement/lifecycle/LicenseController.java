package io.surfworks.entitlement.lifecycle;

import com.google.gson.JsonObject;
import io.surfworks.entitlement.client.ContractException;
import io.surfworks.entitlement.client.LicenseApi;
import io.surfworks.entitlement.client.LicenseClientException;
import io.surfworks.entitlement.client.LicenseResponse;
import io.surfworks.entitlement.client.LogFormat;
import io.surfworks.entitlement.client.RequestException;
import io.surfworks.entitlement.client.Timestamps;
import io.surfworks.entitlement.client.TokenSelector;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the license lifecycle against the remote service and keeps the
 * local {@link LicenseState} in step.
 *
 * <p>Every public operation either returns the service response or throws a
 * {@link LicenseOperationException}; no other exception escapes.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseController controller = new LicenseController(
 *     LicenseApiClient.fromDefaultConfig(),
 *     new FileLicenseStateStore(ClientConfig.configDir()));
 *
 * controller.activate("ABCD-1234-EFGH", null);
 * LicenseHealth health = controller.health();
 * }</pre>
 */
public class LicenseController {

    private static final Logger LOG = Logger.getLogger(LicenseController.class.getName());

    private final LicenseApi api;
    private final LicenseStateStore store;
    private final GracePolicy gracePolicy;
    private final Clock clock;

    public LicenseController(LicenseApi api, LicenseStateStore store) {
        this(api, store, new GracePolicy(), Clock.systemUTC());
    }

    public LicenseController(LicenseApi api, LicenseStateStore store, GracePolicy gracePolicy, Clock clock) {
        this.api = api;
        this.store = store;
        this.gracePolicy = gracePolicy;
        this.clock = clock;
    }

    /**
     * Snapshot of the stored license record.
     */
    public LicenseState currentState() {
        return store.load();
    }

    /**
     * Health summary of the stored license record.
     */
    public LicenseHealth health() {
        return LicenseHealth.of(store.load(), clock.instant());
    }

    /**
     * Store the license key used when operations are called without one.
     */
    public void configureLicenseKey(String licenseKey) throws LicenseOperationException {
        LicenseState state = store.load();
        String key = resolveKey(state, licenseKey);
        state.setLicenseKey(key);
        persist(state);
    }

    /**
     * Activate the license.
     *
     * @param licenseKey license key, or null to use the stored one
     * @param token      activation token to reuse, or null
     * @return the service response
     */
    public LicenseResponse activate(String licenseKey, String token) throws LicenseOperationException {
        LicenseState state = store.load();
        String key = resolveKey(state, licenseKey);
        LOG.info("activate: start key=" + key + " token=" + LogFormat.mask(token));

        try {
            LicenseResponse response = activateAndApply(state, key, token);
            if (state.getLicenseKey().isEmpty()) {
                state.setLicenseKey(key);
                persist(state);
            }
            return response;
        } catch (LicenseClientException e) {
            if (ExpiryErrors.isExpired(e)) {
                markExpired(state, e);
                persist(state);
                throw new LicenseOperationException(LicenseOperationException.Failure.EXPIRED, e);
            }
            LOG.log(Level.SEVERE, "activate: API error: " + e.getMessage(), e);
            recordError(state, e);
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "activate: unexpected error", e);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    /**
     * Activate again with the freshest available token.
     *
     * <p>A preflight validation picks up a rotated token first. If the service
     * reports its activation limit, one more preflight runs and, when it yields
     * a different token, the activation is retried once.
     *
     * @param licenseKey license key, or null to use the stored one
     * @param token      fallback token when the service reports none, or null
     */
    public LicenseResponse reactivate(String licenseKey, String token) throws LicenseOperationException {
        LicenseState state = store.load();
        String key = resolveKey(state, licenseKey);
        LOG.info("reactivate: start key=" + key + " incoming token=" + LogFormat.mask(token)
            + " saved token=" + LogFormat.mask(state.getActivationToken()));

        String effective = preflightRefreshToken(state, key)
            .or(() -> nonBlank(token))
            .or(() -> nonBlank(state.getActivationToken()))
            .orElse(null);
        LOG.info("reactivate: effective token=" + LogFormat.mask(effective));
        if (effective == null) {
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.TOKEN_REQUIRED);
        }

        try {
            return activateAndApply(state, key, effective);
        } catch (ContractException e) {
            if (ExpiryErrors.isExpired(e)) {
                markExpired(state, e);
                persist(state);
                LOG.warning("reactivate: expired, status set EXPIRED: " + e.getMessage());
                throw new LicenseOperationException(LicenseOperationException.Failure.EXPIRED, e);
            }
            LOG.warning("reactivate: first attempt failed with: " + e.getMessage());
            recordError(state, e);
            if (ExpiryErrors.isActivationLimit(e)) {
                return retryAfterActivationLimit(state, key, effective, e);
            }
            LOG.log(Level.SEVERE, "reactivate: non-retryable contract error", e);
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (LicenseClientException e) {
            if (ExpiryErrors.isExpired(e)) {
                markExpired(state, e);
                persist(state);
                throw new LicenseOperationException(LicenseOperationException.Failure.EXPIRED, e);
            }
            LOG.log(Level.SEVERE, "reactivate: API error: " + e.getMessage(), e);
            recordError(state, e);
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "reactivate: unexpected error", e);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    /**
     * Deactivate the license and hard-lock locally.
     *
     * <p>The local outcome is {@link LicenseStatus#LOCK_HARD} whatever the
     * service answers. Without a token from the caller or the preflight, every
     * activation of the key is deactivated.
     *
     * @param licenseKey license key, or null to use the stored one
     * @param token      activation to deactivate, or null
     */
    public LicenseResponse deactivate(String licenseKey, String token) throws LicenseOperationException {
        LicenseState state = store.load();
        String key = resolveKey(state, licenseKey);
        LOG.info("deactivate: start key=" + key + " incoming token=" + LogFormat.mask(token)
            + " saved token=" + LogFormat.mask(state.getActivationToken()));

        String target = nonBlank(token).orElse(null);
        if (target == null) {
            target = preflightRefreshToken(state, key)
                .or(() -> nonBlank(state.getActivationToken()))
                .orElse(null);
            LOG.info("deactivate: token after preflight=" + LogFormat.mask(target) + " (none means all activations)");
        }

        try {
            LicenseResponse response = api.deactivate(key, target);
            state.setLastResponseRaw(LogFormat.compact(response.body()));
            applyExpiry(state, response);
            state.setStatus(LicenseStatus.DEACTIVATED);
            state.setReason("Deactivated");
            state.setActivationToken("");
            hardLock(state, "License deactivated");

            refreshAfterDeactivation(state, key);

            hardLock(state, "License deactivated");
            persist(state);
            return response;
        } catch (LicenseClientException e) {
            LOG.log(Level.SEVERE, "deactivate: API error: " + e.getMessage(), e);
            recordError(state, e);
            hardLock(state, "Deactivate failed: " + e.getMessage());
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "deactivate: unexpected error", e);
            hardLock(state, "Deactivate unexpected error: " + e.getMessage());
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    /**
     * Confirm the license with the service.
     *
     * <p>Always calls the service, including from EXPIRED, so an extended
     * expiry date is picked up. Failures engage the {@link GracePolicy}.
     *
     * @param licenseKey license key, or null to use the stored one
     */
    public LicenseResponse validate(String licenseKey) throws LicenseOperationException {
        LicenseState state = store.load();
        String key = resolveKey(state, licenseKey);
        LOG.info("validate: start key=" + key + " status=" + state.getStatus());

        try {
            LicenseResponse response = api.validate(key);
            state.setLastResponseRaw(LogFormat.compact(response.body()));
            applyValidationUpdate(state, response);
            boolean changed = adoptLatestToken(state, response);
            LOG.info("validate: status=" + state.getStatus() + " token changed=" + changed
                + " token=" + LogFormat.mask(state.getActivationToken()));
            persist(state);
            return response;
        } catch (LicenseClientException e) {
            LOG.log(Level.SEVERE, "validate: API error: " + e.getMessage(), e);
            recordError(state, e);
            gracePolicy.apply(state, e.getMessage(), clock.instant());
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "validate: unexpected error", e);
            gracePolicy.apply(state, "Unexpected error: " + e.getMessage(), clock.instant());
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    /**
     * Validate using the stored license key.
     */
    public LicenseResponse validate() throws LicenseOperationException {
        return validate(null);
    }

    // ========== State transitions ==========

    private LicenseResponse activateAndApply(LicenseState state, String key, String token)
            throws LicenseClientException, LicenseOperationException {
        LicenseResponse response = api.activate(key, token);
        state.setLastResponseRaw(LogFormat.compact(response.body()));
        applyActivationUpdate(state, response);
        boolean changed = adoptLatestToken(state, response);
        LOG.info("activate: status=" + state.getStatus() + " token changed=" + changed
            + " token=" + LogFormat.mask(state.getActivationToken()));
        persist(state);
        return response;
    }

    private LicenseResponse retryAfterActivationLimit(LicenseState state, String key, String firstToken,
                                                      ContractException firstFailure)
            throws LicenseOperationException {
        String fresh = preflightRefreshToken(state, key).orElse(firstToken);
        if (fresh.equals(firstToken)) {
            LOG.info("reactivate: retry skipped (no fresh token from preflight)");
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.ACTIVATION_LIMIT, firstFailure);
        }

        LOG.info("reactivate: retry with token=" + LogFormat.mask(fresh));
        try {
            return activateAndApply(state, key, fresh);
        } catch (RequestException e) {
            recordError(state, e);
            persist(state);
            if (e.isDuplicateBlocked()) {
                LOG.warning("reactivate: idempotency guard hit on retry");
                throw new LicenseOperationException(LicenseOperationException.Failure.ACTIVATION_SETTLING, e);
            }
            LOG.log(Level.SEVERE, "reactivate: retry failed: " + e.getMessage(), e);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (LicenseClientException e) {
            LOG.log(Level.SEVERE, "reactivate: retry failed: " + e.getMessage(), e);
            recordError(state, e);
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.OPERATION_FAILED, e);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "reactivate: retry failed unexpectedly", e);
            persist(state);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    /**
     * Validate only to learn the current token; failures are logged and
     * otherwise ignored.
     *
     * @return the latest token the service reported, if any
     */
    private Optional<String> preflightRefreshToken(LicenseState state, String key) {
        LOG.info("preflight: validating key=" + key);
        try {
            LicenseResponse response = api.validate(key);
            state.setLastResponseRaw(LogFormat.compact(response.body()));
            String before = state.getActivationToken();
            boolean changed = adoptLatestToken(state, response);
            LOG.info("preflight: token changed=" + changed + " before=" + LogFormat.mask(before)
                + " after=" + LogFormat.mask(state.getActivationToken()));
            if (changed) {
                state.setReason("Token rotated from validate");
            }
            return TokenSelector.extractLatestToken(response);
        } catch (LicenseClientException | RuntimeException e) {
            LOG.log(Level.WARNING, "preflight: validate failed: " + e.getMessage(), e);
            return Optional.empty();
        }
    }

    private void refreshAfterDeactivation(LicenseState state, String key) {
        try {
            LicenseResponse response = api.validate(key);
            LOG.info("deactivate: post-validate response=" + response);
            state.setLastResponseRaw(LogFormat.compact(response.body()));
            applyValidationUpdate(state, response);
        } catch (LicenseClientException | RuntimeException e) {
            LOG.log(Level.WARNING, "deactivate: post-validate skipped: " + e.getMessage(), e);
        }
    }

    private void applyActivationUpdate(LicenseState state, LicenseResponse response) {
        Instant now = clock.instant();
        applyExpiry(state, response);
        state.setStatus(LicenseStatus.ACTIVE);
        state.setReason("Activated");
        state.setLastValidated(now);
        state.setGraceUntil(null);
    }

    /**
     * Shared update after a successful validation.
     *
     * <p>An expiry date in the past wins over everything else, whatever the
     * previous status was. Otherwise the license is VALIDATED when any
     * activation is live, DEACTIVATED when none is.
     */
    void applyValidationUpdate(LicenseState state, LicenseResponse response) {
        Instant now = clock.instant();
        LicenseStatus previous = state.getStatus();
        applyExpiry(state, response);

        if (state.getExpiresAt() != null && now.isAfter(state.getExpiresAt())) {
            if (previous != LicenseStatus.EXPIRED || state.getReason().isBlank()) {
                state.setReason("License expired");
            }
            state.setStatus(LicenseStatus.EXPIRED);
            if (state.getGraceUntil() == null) {
                state.setGraceUntil(now);
            }
            state.setLastValidated(now);
            LOG.info("validation update: expires_at " + state.getExpiresAt() + " in past, status EXPIRED");
            return;
        }

        boolean active = response.hasActiveActivation();
        if (active) {
            state.setStatus(LicenseStatus.VALIDATED);
            state.setReason(previous.isGrace() ? "Grace cleared after success" : "Validated");
        } else {
            state.setStatus(LicenseStatus.DEACTIVATED);
            state.setReason("Validated (no active activation)");
        }
        state.setLastValidated(now);
        state.setGraceUntil(null);
        LOG.info("validation update: status=" + state.getStatus() + " active=" + active
            + " expires_at=" + state.getExpiresAt());
    }

    private void applyExpiry(LicenseState state, LicenseResponse response) {
        Timestamps.parse(response.expiresAt()).ifPresent(state::setExpiresAt);
    }

    private boolean adoptLatestToken(LicenseState state, LicenseResponse response) {
        Optional<String> latest = TokenSelector.extractLatestToken(response);
        if (latest.isEmpty() || latest.get().equals(state.getActivationToken())) {
            return false;
        }
        state.setActivationToken(latest.get());
        return true;
    }

    private void markExpired(LicenseState state, LicenseClientException e) {
        Instant now = clock.instant();
        String message = e.getMessage() != null ? e.getMessage() : "";
        ExpiryErrors.parseExpiry(message).ifPresent(state::setExpiresAt);
        state.setStatus(LicenseStatus.EXPIRED);
        state.setReason(message.isBlank() ? "License expired" : message);
        if (state.getGraceUntil() == null) {
            state.setGraceUntil(now);
        }
        state.setLastValidated(now);
        recordError(state, e);
        LOG.warning("license expired: expires_at=" + state.getExpiresAt() + " reason=" + state.getReason());
    }

    private void hardLock(LicenseState state, String reason) {
        state.setStatus(LicenseStatus.LOCK_HARD);
        state.setReason(reason);
        state.setGraceUntil(clock.instant());
    }

    private void recordError(LicenseState state, LicenseClientException e) {
        String code = ExpiryErrors.errorCode(e);
        JsonObject error = new JsonObject();
        error.addProperty("ts", Timestamps.format(clock.instant()));
        error.addProperty("code", code);
        error.addProperty("status", ExpiryErrors.errorStatus(e, code));
        error.addProperty("message", e.getMessage());
        state.setLastErrorRaw(LogFormat.compact(error));
    }

    private void persist(LicenseState state) throws LicenseOperationException {
        try {
            store.save(state);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to save license state", e);
            throw new LicenseOperationException(LicenseOperationException.Failure.UNEXPECTED, e);
        }
    }

    private static String resolveKey(LicenseState state, String licenseKey) throws LicenseOperationException {
        String key = nonBlank(licenseKey).or(() -> nonBlank(state.getLicenseKey())).orElse(null);
        if (key == null) {
            throw new LicenseOperationException(LicenseOperationException.Failure.KEY_REQUIRED);
        }
        return key;
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
