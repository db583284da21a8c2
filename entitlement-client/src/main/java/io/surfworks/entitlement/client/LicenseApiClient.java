package io.surfworks.entitlement.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * HTTP client for the remote license service.
 *
 * <p>Endpoints are {@code GET {base}/activate/{key}}, {@code /deactivate/{key}}
 * and {@code /validate/{key}}, each taking an optional {@code token} query
 * parameter and HTTP Basic credentials.
 *
 * <p>Only transport failures are retried, with exponential backoff
 * ({@code backoff * 2^attempt}). Received HTTP responses are classified by
 * {@link ResponseContract} and never retried.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseApiClient client = new LicenseApiClient(ClientConfigLoader.load());
 * LicenseResponse response = client.validate("ABCD-1234-EFGH");
 * }</pre>
 */
public class LicenseApiClient implements LicenseApi {

    private static final Logger LOG = Logger.getLogger(LicenseApiClient.class.getName());

    private static final Pattern LICENSE_KEY = Pattern.compile("^[A-Z0-9\\-]{10,}$");
    private static final Pattern TOKEN = Pattern.compile("^[A-Fa-f0-9]{16,128}$");
    private static final String LOCK_PREFIX = "entitlement:activate_lock:v2:activate:";
    private static final int LOCK_TOKEN_PREFIX = 16;

    private final ClientConfig config;
    private final HttpTransport transport;
    private final ActivationLock activationLock;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String authorization;

    /**
     * Create a client with the JDK transport and an in-process activation lock.
     */
    public LicenseApiClient(ClientConfig config) {
        this(config, new JdkHttpTransport(config), new InMemoryActivationLock(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    /**
     * Create a client with explicit collaborators.
     *
     * @param config         connection settings
     * @param transport      sends requests
     * @param activationLock idempotency guard for activate
     * @param sleeper        waits between retries
     * @param clock          source of the cache-busting timestamp
     */
    public LicenseApiClient(ClientConfig config, HttpTransport transport, ActivationLock activationLock,
                            Sleeper sleeper, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.activationLock = activationLock;
        this.sleeper = sleeper;
        this.clock = clock;
        String credentials = config.apiKey() + ":" + config.apiSecret();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        LOG.info("LicenseApiClient: base=" + config.baseUrl() + " verifyTls=" + config.verifyTls()
            + " timeout=" + config.timeout().toSeconds() + "s retries=" + config.retryCount());
    }

    /**
     * Create a client from the default configuration sources.
     */
    public static LicenseApiClient fromDefaultConfig() throws ConfigException {
        return new LicenseApiClient(ClientConfigLoader.load());
    }

    public ClientConfig config() {
        return config;
    }

    @Override
    public LicenseResponse activate(String licenseKey, String token) throws LicenseClientException {
        checkLicenseKey(licenseKey);
        if (token != null) {
            checkToken(token);
        }

        String lockKey = activationLockKey(licenseKey, token);
        LOG.info("activate: key=" + licenseKey + " token=" + LogFormat.mask(token) + " lock=" + lockKey);
        if (!acquireActivationLock(lockKey)) {
            LOG.severe("activate: idempotency guard hit for " + lockKey);
            throw RequestException.duplicateBlocked();
        }

        LicenseResponse response = get("/activate/" + licenseKey, tokenParam(token));
        LOG.info("activate: response=" + response);
        return response;
    }

    @Override
    public LicenseResponse reactivate(String licenseKey, String token) throws LicenseClientException {
        LOG.info("reactivate: key=" + licenseKey + " token=" + LogFormat.mask(token));
        return LicenseApi.super.reactivate(licenseKey, token);
    }

    @Override
    public LicenseResponse deactivate(String licenseKey, String token) throws LicenseClientException {
        checkLicenseKey(licenseKey);
        if (token != null) {
            checkToken(token);
        }
        LOG.info("deactivate: key=" + licenseKey + " token=" + LogFormat.mask(token));

        LicenseResponse response = get("/deactivate/" + licenseKey, tokenParam(token));
        LOG.info("deactivate: response=" + response);
        return response;
    }

    @Override
    public LicenseResponse validate(String licenseKey) throws LicenseClientException {
        checkLicenseKey(licenseKey);
        LOG.info("validate: key=" + licenseKey);

        LicenseResponse response = get("/validate/" + licenseKey, new LinkedHashMap<>());
        LOG.info("validate: response=" + response);
        return response;
    }

    // ========== Internals ==========

    static String activationLockKey(String licenseKey, String token) {
        String fragment = token != null ? token : "none";
        if (fragment.length() > LOCK_TOKEN_PREFIX) {
            fragment = fragment.substring(0, LOCK_TOKEN_PREFIX);
        }
        return LOCK_PREFIX + licenseKey + ":" + fragment;
    }

    private boolean acquireActivationLock(String lockKey) {
        try {
            boolean acquired = activationLock.tryAcquire(lockKey, config.activationLockTtl());
            LOG.fine("activation lock " + lockKey + " ttl=" + config.activationLockTtl() + " acquired=" + acquired);
            return acquired;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "activation lock unavailable; failing open", e);
            return true;
        }
    }

    private LicenseResponse get(String path, Map<String, String> params)
            throws RequestException, ContractException {
        String url = config.baseUrl() + path;
        LOG.info("HTTP GET " + url + " params=" + LogFormat.compact(LogFormat.safeParams(params))
            + " verifyTls=" + config.verifyTls() + " timeout=" + config.timeout().toSeconds() + "s");

        for (int attempt = 0; ; attempt++) {
            params.put("_", Long.toString(clock.millis()));
            HttpRequest request = buildRequest(url, params);
            HttpResponse<String> response;
            try {
                response = transport.send(request);
            } catch (IOException e) {
                LOG.warning("network error on GET " + url + " attempt=" + attempt + "/" + config.retryCount()
                    + ": " + e);
                if (attempt >= config.retryCount()) {
                    throw new RequestException("Network error: " + describe(e), e);
                }
                backoff(attempt);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RequestException("Request interrupted", e);
            }

            LOG.info("HTTP " + response.statusCode() + " " + url);
            return ResponseContract.interpret(response.statusCode(), response.body());
        }
    }

    private HttpRequest buildRequest(String url, Map<String, String> params) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url + "?" + queryString(params)))
            .header("Accept", "application/json")
            .header("User-Agent", config.userAgent())
            .header("Cache-Control", "no-cache")
            .header("Pragma", "no-cache")
            .header("Authorization", authorization)
            .timeout(config.timeout())
            .GET()
            .build();
    }

    private void backoff(int attempt) throws RequestException {
        Duration delay = config.backoff().multipliedBy(1L << attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException("Request interrupted", e);
        }
    }

    private static Map<String, String> tokenParam(String token) {
        Map<String, String> params = new LinkedHashMap<>();
        if (token != null && !token.isBlank()) {
            params.put("token", token.strip());
        }
        return params;
    }

    private static String queryString(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (sb.length() > 0) sb.append("&");
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
            sb.append("=");
            sb.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static void checkLicenseKey(String licenseKey) throws ConfigException {
        if (licenseKey == null || licenseKey.isEmpty()) {
            LOG.severe("checkLicenseKey: empty license key");
            throw new ConfigException("license_key must be a non-empty string");
        }
        if (!LICENSE_KEY.matcher(licenseKey).matches()) {
            LOG.severe("checkLicenseKey: invalid format key=" + licenseKey);
            throw new ConfigException("license_key format looks invalid (expect A-Z, 0-9 and dashes)");
        }
    }

    private static void checkToken(String token) throws ConfigException {
        if (token.isEmpty()) {
            LOG.severe("checkToken: empty token");
            throw new ConfigException("token must be a non-empty string");
        }
        if (!TOKEN.matcher(token).matches()) {
            LOG.severe("checkToken: invalid token format token=" + LogFormat.mask(token));
            throw new ConfigException("token format looks invalid (expect hex-like string)");
        }
    }
}
