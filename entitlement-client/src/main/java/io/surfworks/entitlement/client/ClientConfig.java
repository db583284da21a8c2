package io.surfworks.entitlement.client;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Connection settings for the remote license API.
 *
 * <p>Use {@link #of(String, String, String, boolean)} to build a validated
 * configuration; the {@code with*} methods derive tuned copies.
 *
 * @param baseUrl            service base URL, without trailing slash
 * @param apiKey             HTTP Basic user (consumer key)
 * @param apiSecret          HTTP Basic password (consumer secret)
 * @param verifyTls          whether TLS certificates are verified
 * @param timeout            per-request timeout
 * @param retryCount         extra attempts after a transport failure
 * @param backoff            base delay, doubled on every retry
 * @param userAgent          User-Agent header value
 * @param activationLockTtl  lifetime of the activation idempotency lock
 * @param logLevel           log level name for the entitlement loggers (may be null)
 */
public record ClientConfig(
        String baseUrl,
        String apiKey,
        String apiSecret,
        boolean verifyTls,
        Duration timeout,
        int retryCount,
        Duration backoff,
        String userAgent,
        Duration activationLockTtl,
        String logLevel
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_ACTIVATION_LOCK_TTL = Duration.ofSeconds(8);
    public static final String DEFAULT_USER_AGENT = "EntitlementClient/1.0";

    /** Config directory */
    public static final Path DEFAULT_CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "entitlement"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "config.json";

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        Objects.requireNonNull(apiKey, "apiKey cannot be null");
        Objects.requireNonNull(apiSecret, "apiSecret cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(backoff, "backoff cannot be null");
        Objects.requireNonNull(userAgent, "userAgent cannot be null");
        Objects.requireNonNull(activationLockTtl, "activationLockTtl cannot be null");

        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Builds a configuration with default tuning after checking the required
     * values.
     *
     * @throws ConfigException if the URL, key or secret is missing or malformed
     */
    public static ClientConfig of(String baseUrl, String apiKey, String apiSecret, boolean verifyTls)
            throws ConfigException {
        if (isBlank(baseUrl) || isBlank(apiKey) || isBlank(apiSecret)) {
            throw new ConfigException("Missing base_url / api_key / api_secret in license configuration");
        }
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String lower = base.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("https://") && !lower.startsWith("http://")) {
            throw new ConfigException("base_url must be an http(s) URL: " + base);
        }
        if (verifyTls && lower.startsWith("http://")) {
            throw new ConfigException("base_url uses plain http; set allow_insecure_http to permit it");
        }
        return new ClientConfig(
                base,
                apiKey.trim(),
                apiSecret.trim(),
                verifyTls,
                DEFAULT_TIMEOUT,
                DEFAULT_RETRY_COUNT,
                DEFAULT_BACKOFF,
                DEFAULT_USER_AGENT,
                DEFAULT_ACTIVATION_LOCK_TTL,
                null
        );
    }

    /**
     * Directory holding the config file and the local license state.
     */
    public static Path configDir() {
        String configHome = System.getenv("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "entitlement");
        }
        return DEFAULT_CONFIG_DIR;
    }

    /**
     * Returns the default config file path.
     */
    public static Path configFile() {
        return configDir().resolve(CONFIG_FILE);
    }

    public ClientConfig withTimeout(Duration timeout) {
        return new ClientConfig(baseUrl, apiKey, apiSecret, verifyTls, timeout, retryCount, backoff,
                userAgent, activationLockTtl, logLevel);
    }

    public ClientConfig withRetry(int retryCount, Duration backoff) {
        return new ClientConfig(baseUrl, apiKey, apiSecret, verifyTls, timeout, retryCount, backoff,
                userAgent, activationLockTtl, logLevel);
    }

    public ClientConfig withUserAgent(String userAgent) {
        return new ClientConfig(baseUrl, apiKey, apiSecret, verifyTls, timeout, retryCount, backoff,
                userAgent, activationLockTtl, logLevel);
    }

    public ClientConfig withActivationLockTtl(Duration activationLockTtl) {
        return new ClientConfig(baseUrl, apiKey, apiSecret, verifyTls, timeout, retryCount, backoff,
                userAgent, activationLockTtl, logLevel);
    }

    public ClientConfig withLogLevel(String logLevel) {
        return new ClientConfig(baseUrl, apiKey, apiSecret, verifyTls, timeout, retryCount, backoff,
                userAgent, activationLockTtl, logLevel);
    }

    /**
     * Keeps the secret out of logs and exception messages.
     */
    @Override
    public String toString() {
        return "ClientConfig[baseUrl=" + baseUrl
                + ", apiKey=" + LogFormat.mask(apiKey)
                + ", verifyTls=" + verifyTls
                + ", timeout=" + timeout
                + ", retryCount=" + retryCount
                + ", backoff=" + backoff
                + ", userAgent=" + userAgent + "]";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
