package io.surfworks.entitlement.client;

import com.google.gson.JsonObject;

import java.util.Locale;

/**
 * Transport-level failure or an HTTP error status (>= 400).
 */
public class RequestException extends LicenseClientException {

    /**
     * Status used when the activation idempotency guard rejects a call.
     */
    public static final int DUPLICATE_STATUS = 409;

    static final String DUPLICATE_MESSAGE = "Duplicate activate blocked by idempotency guard";

    public RequestException(String message) {
        super(message);
    }

    public RequestException(String message, Throwable cause) {
        super(message, null, null, cause);
    }

    public RequestException(String message, Integer status, JsonObject payload) {
        super(message, status, payload);
    }

    static RequestException duplicateBlocked() {
        return new RequestException(DUPLICATE_MESSAGE, DUPLICATE_STATUS, null);
    }

    /**
     * Whether this failure came from the activation idempotency guard rather
     * than from the remote service.
     */
    public boolean isDuplicateBlocked() {
        Integer status = status();
        return status != null && status == DUPLICATE_STATUS
            && getMessage() != null
            && getMessage().toLowerCase(Locale.ROOT).contains("idempotency guard");
    }
}
