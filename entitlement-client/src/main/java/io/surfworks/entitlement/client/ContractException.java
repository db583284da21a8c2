package io.surfworks.entitlement.client;

import com.google.gson.JsonObject;

/**
 * The server answered with HTTP success but the body reports a failure
 * (embedded {@code errors}/{@code error_data}), or the body is not JSON.
 */
public class ContractException extends LicenseClientException {

    /**
     * Code used when the body carries no usable error code.
     */
    public static final String DEFAULT_CODE = "lmfwc_error";

    private final String code;

    public ContractException(String message, String code, Integer status, JsonObject payload) {
        super(message, status, payload);
        this.code = code != null ? code : DEFAULT_CODE;
    }

    public ContractException(String message, Integer status, JsonObject payload, Throwable cause) {
        super(message, status, payload, cause);
        this.code = DEFAULT_CODE;
    }

    /**
     * Embedded error code, e.g. {@code lmfwc_rest_license_expired}.
     */
    public String code() {
        return code;
    }
}
