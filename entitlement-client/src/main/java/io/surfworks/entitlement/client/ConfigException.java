package io.surfworks.entitlement.client;

/**
 * Missing or malformed local configuration, or an input that fails the shape
 * checks. Always raised before any network I/O.
 */
public class ConfigException extends LicenseClientException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, null, null, cause);
    }
}
