package io.surfworks.entitlement.client;

import com.google.gson.JsonObject;

/**
 * Base exception for failures raised by the license API client.
 *
 * <p>Carries the HTTP (or embedded) status when one is known, and the raw
 * payload the server returned so callers can keep it for diagnostics.
 */
public class LicenseClientException extends Exception {

    private final Integer status;
    private final JsonObject payload;

    public LicenseClientException(String message) {
        this(message, null, null, null);
    }

    public LicenseClientException(String message, Integer status, JsonObject payload) {
        this(message, status, payload, null);
    }

    public LicenseClientException(String message, Integer status, JsonObject payload, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.payload = payload != null ? payload : new JsonObject();
    }

    /**
     * HTTP or embedded status code, or null if none was reported.
     */
    public Integer status() {
        return status;
    }

    /**
     * Payload returned by the server. Never null; empty when absent.
     */
    public JsonObject payload() {
        return payload;
    }
}
