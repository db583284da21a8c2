package io.surfworks.entitlement.client;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends a prepared request and returns the response body as text.
 *
 * <p>{@link IOException}s are treated as transport failures and retried by
 * {@link LicenseApiClient}.
 */
@FunctionalInterface
public interface HttpTransport {

    HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException;
}
