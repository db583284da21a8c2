package io.surfworks.entitlement.client;

/**
 * Remote license operations.
 *
 * <p>{@link LicenseApiClient} talks to the service over HTTP; tests supply
 * their own implementations.
 */
public interface LicenseApi {

    /**
     * Activate a license key, optionally reusing an existing activation token.
     *
     * @param licenseKey the license key
     * @param token      activation token to reuse, or null
     * @return the service response
     */
    LicenseResponse activate(String licenseKey, String token) throws LicenseClientException;

    /**
     * Deactivate one activation, or all of them when {@code token} is null.
     */
    LicenseResponse deactivate(String licenseKey, String token) throws LicenseClientException;

    /**
     * Fetch the current license record.
     */
    LicenseResponse validate(String licenseKey) throws LicenseClientException;

    /**
     * Activate again with a known token.
     *
     * @throws ConfigException if no token is supplied
     */
    default LicenseResponse reactivate(String licenseKey, String token) throws LicenseClientException {
        if (token == null || token.isBlank()) {
            throw new ConfigException("token is required to reactivate");
        }
        return activate(licenseKey, token);
    }
}
