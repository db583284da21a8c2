package io.surfworks.entitlement.lifecycle;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.surfworks.entitlement.client.ContractException;
import io.surfworks.entitlement.client.LicenseClientException;
import io.surfworks.entitlement.client.Timestamps;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads expiry and activation-limit conditions out of client failures.
 */
final class ExpiryErrors {

    static final String EXPIRED_CODE = "lmfwc_rest_license_expired";

    private static final Pattern EXPIRED_ON = Pattern.compile(
        "expired on\\s+([\\d:\\-\\s]+)\\s*\\(UTC\\)", Pattern.CASE_INSENSITIVE);

    private ExpiryErrors() {}

    static boolean isExpired(LicenseClientException e) {
        String message = e.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("expire")) {
            return true;
        }
        if (e instanceof ContractException contract && EXPIRED_CODE.equals(contract.code())) {
            return true;
        }
        return embeddedErrors(e).has(EXPIRED_CODE);
    }

    static boolean isActivationLimit(LicenseClientException e) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        return message.contains("activation limit") || message.contains("maximum activation");
    }

    /**
     * Expiry date embedded in a message such as
     * {@code "... expired on 2025-10-10 00:00:00 (UTC)"}.
     */
    static Optional<Instant> parseExpiry(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher m = EXPIRED_ON.matcher(message);
        if (!m.find()) {
            return Optional.empty();
        }
        return Timestamps.parse(m.group(1).trim());
    }

    /**
     * First embedded error code, or null.
     */
    static String errorCode(LicenseClientException e) {
        if (e instanceof ContractException contract) {
            return contract.code();
        }
        JsonObject errors = embeddedErrors(e);
        return errors.keySet().isEmpty() ? null : errors.keySet().iterator().next();
    }

    /**
     * Status reported with the failure, falling back to the embedded
     * {@code error_data} entry for the error code.
     */
    static Integer errorStatus(LicenseClientException e, String code) {
        if (e.status() != null) {
            return e.status();
        }
        JsonObject data = dataObject(e);
        JsonElement errorData = data.get("error_data");
        if (code == null || errorData == null || !errorData.isJsonObject()) {
            return null;
        }
        JsonElement entry = errorData.getAsJsonObject().get(code);
        if (entry == null || !entry.isJsonObject() || !entry.getAsJsonObject().has("status")) {
            return null;
        }
        try {
            return entry.getAsJsonObject().get("status").getAsInt();
        } catch (RuntimeException ex) {
            return null;
        }
    }

    private static JsonObject embeddedErrors(LicenseClientException e) {
        JsonElement errors = dataObject(e).get("errors");
        return errors != null && errors.isJsonObject() ? errors.getAsJsonObject() : new JsonObject();
    }

    private static JsonObject dataObject(LicenseClientException e) {
        JsonElement data = e.payload().get("data");
        return data != null && data.isJsonObject() ? data.getAsJsonObject() : new JsonObject();
    }
}
