package io.surfworks.entitlement.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LicenseApiClient}.
 */
class LicenseApiClientTest {

    private static final String KEY = "ABCD-1234-EFGH";
    private static final String TOKEN = "0123456789abcdef0123";
    private static final String OK_BODY = "{\"success\":true,\"data\":{\"licenseKey\":\"ABCD-1234-EFGH\"}}";

    private ClientConfig config;
    private FakeTransport transport;
    private InMemoryActivationLock lock;
    private List<Duration> sleeps;
    private LicenseApiClient client;

    @BeforeEach
    void setUp() throws ConfigException {
        config = ClientConfig.of("https://licenses.example.com/v2/licenses/", "ck_test", "cs_test", true);
        transport = new FakeTransport();
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
        lock = new InMemoryActivationLock(clock);
        sleeps = new ArrayList<>();
        client = new LicenseApiClient(config, transport, lock, sleeps::add, clock);
    }

    @Test
    @DisplayName("validate issues an authenticated GET with cache-busting and no-cache headers")
    void validate_buildsRequest() throws LicenseClientException {
        transport.reply(200, OK_BODY);

        var response = client.validate(KEY);

        HttpRequest request = transport.lastRequest();
        assertEquals("GET", request.method());
        assertEquals("/v2/licenses/validate/" + KEY, request.uri().getPath());
        assertEquals("_=" + Instant.parse("2025-06-01T12:00:00Z").toEpochMilli(), request.uri().getQuery());
        assertEquals("application/json", request.headers().firstValue("Accept").orElse(null));
        assertEquals("no-cache", request.headers().firstValue("Cache-Control").orElse(null));
        assertEquals("no-cache", request.headers().firstValue("Pragma").orElse(null));
        assertEquals(ClientConfig.DEFAULT_USER_AGENT, request.headers().firstValue("User-Agent").orElse(null));
        String expectedAuth = "Basic " + Base64.getEncoder()
            .encodeToString("ck_test:cs_test".getBytes(StandardCharsets.UTF_8));
        assertEquals(expectedAuth, request.headers().firstValue("Authorization").orElse(null));
        assertEquals(Duration.ofSeconds(30), request.timeout().orElse(null));

        assertEquals(KEY, response.data().getAsJsonObject().get("licenseKey").getAsString());
    }

    @Test
    @DisplayName("activate passes the token as a query parameter")
    void activate_withToken_addsQueryParameter() throws LicenseClientException {
        transport.reply(200, OK_BODY);

        client.activate(KEY, TOKEN);

        HttpRequest request = transport.lastRequest();
        assertEquals("/v2/licenses/activate/" + KEY, request.uri().getPath());
        assertTrue(request.uri().getQuery().startsWith("token=" + TOKEN + "&_="));
    }

    @Test
    @DisplayName("deactivate without token targets all activations")
    void deactivate_withoutToken_hasNoTokenParameter() throws LicenseClientException {
        transport.reply(200, OK_BODY);

        client.deactivate(KEY, null);

        HttpRequest request = transport.lastRequest();
        assertEquals("/v2/licenses/deactivate/" + KEY, request.uri().getPath());
        assertFalse(request.uri().getQuery().contains("token="));
    }

    @Test
    @DisplayName("malformed license key fails before any network call")
    void invalidLicenseKey_rejectedLocally() {
        assertThrows(ConfigException.class, () -> client.validate("lic-1"));
        assertThrows(ConfigException.class, () -> client.validate("SHORT-1"));
        assertThrows(ConfigException.class, () -> client.activate("", null));
        assertTrue(transport.requests.isEmpty());
    }

    @Test
    @DisplayName("malformed token fails before any network call")
    void invalidToken_rejectedLocally() {
        assertThrows(ConfigException.class, () -> client.activate(KEY, "not-hex-token-value"));
        assertThrows(ConfigException.class, () -> client.activate(KEY, "abc123"));
        assertThrows(ConfigException.class, () -> client.deactivate(KEY, "zz"));
        assertTrue(transport.requests.isEmpty());
    }

    @Test
    @DisplayName("reactivate requires a token")
    void reactivate_withoutToken_fails() {
        assertThrows(ConfigException.class, () -> client.reactivate(KEY, null));
        assertTrue(transport.requests.isEmpty());
    }

    @Test
    @DisplayName("second activate inside the guard window is blocked without a network call")
    void activate_twice_secondBlockedByGuard() throws LicenseClientException {
        transport.reply(200, OK_BODY);

        client.activate(KEY, TOKEN);
        var error = assertThrows(RequestException.class, () -> client.activate(KEY, TOKEN));

        assertEquals(409, error.status());
        assertTrue(error.isDuplicateBlocked());
        assertEquals(1, transport.requests.size());
    }

    @Test
    @DisplayName("guard is keyed by token prefix")
    void activate_differentToken_notBlocked() throws LicenseClientException {
        transport.reply(200, OK_BODY).reply(200, OK_BODY);

        client.activate(KEY, TOKEN);
        client.activate(KEY, "fedcba9876543210fedc");

        assertEquals(2, transport.requests.size());
    }

    @Test
    @DisplayName("lock store outage fails open")
    void activate_lockStoreDown_proceeds() throws LicenseClientException {
        ActivationLock broken = (key, ttl) -> {
            throw new IllegalStateException("cache down");
        };
        var failOpen = new LicenseApiClient(config, transport, broken, sleeps::add, Clock.systemUTC());
        transport.reply(200, OK_BODY).reply(200, OK_BODY);

        failOpen.activate(KEY, TOKEN);
        failOpen.activate(KEY, TOKEN);

        assertEquals(2, transport.requests.size());
    }

    @Test
    @DisplayName("transport failures are retried with exponential backoff")
    void transportFailure_retriedWithBackoff() throws LicenseClientException {
        transport
            .fail(new HttpTimeoutException("timed out"))
            .fail(new ConnectException("refused"))
            .fail(new IOException("reset"))
            .reply(200, OK_BODY);

        var response = client.validate(KEY);

        assertNotNull(response);
        assertEquals(4, transport.requests.size());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
    }

    @Test
    @DisplayName("exhausted retries raise a network error")
    void transportFailure_exhausted_throwsRequestException() {
        for (int i = 0; i < 4; i++) {
            transport.fail(new ConnectException("refused"));
        }

        var error = assertThrows(RequestException.class, () -> client.validate(KEY));

        assertTrue(error.getMessage().startsWith("Network error:"));
        assertNull(error.status());
        assertEquals(4, transport.requests.size());
        assertEquals(3, sleeps.size());
    }

    @Test
    @DisplayName("HTTP error responses are not retried")
    void httpError_notRetried() {
        transport.reply(503, "{\"code\":\"unavailable\",\"message\":\"Service down\"}");

        var error = assertThrows(RequestException.class, () -> client.validate(KEY));

        assertEquals("Service down", error.getMessage());
        assertEquals(503, error.status());
        assertEquals(1, transport.requests.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("embedded errors surface as contract errors")
    void embeddedError_throwsContractException() {
        transport.reply(200, """
            {"success":true,"data":{"errors":{"lmfwc_rest_license_expired":["The license expired on 2025-01-01 00:00:00 (UTC)."]},
             "error_data":{"lmfwc_rest_license_expired":{"status":410}}}}
            """);

        var error = assertThrows(ContractException.class, () -> client.activate(KEY, null));

        assertEquals("lmfwc_rest_license_expired", error.code());
        assertEquals(410, error.status());
        assertEquals("The license expired on 2025-01-01 00:00:00 (UTC).", error.getMessage());
    }

    @Test
    @DisplayName("plain http base URL requires TLS verification to be off")
    void insecureBaseUrl_requiresFlag() throws ConfigException {
        assertThrows(ConfigException.class,
            () -> ClientConfig.of("http://localhost:8080", "ck", "cs", true));

        var insecure = ClientConfig.of("http://localhost:8080/", "ck", "cs", false);
        assertEquals("http://localhost:8080", insecure.baseUrl());
        assertFalse(insecure.verifyTls());
    }

    @Test
    @DisplayName("lock key keeps only the first sixteen token characters")
    void activationLockKey_usesTokenPrefix() {
        assertEquals("entitlement:activate_lock:v2:activate:" + KEY + ":none",
            LicenseApiClient.activationLockKey(KEY, null));
        assertEquals("entitlement:activate_lock:v2:activate:" + KEY + ":0123456789abcdef",
            LicenseApiClient.activationLockKey(KEY, TOKEN));
    }
}
