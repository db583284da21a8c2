package io.surfworks.entitlement.client;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.logging.Logger;

/**
 * {@link HttpTransport} backed by {@link HttpClient}.
 *
 * <p>With TLS verification off the client accepts any certificate chain.
 * Hostname checks can only be turned off JVM-wide through the
 * {@code jdk.internal.httpclient.disableHostnameVerification} property.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = Logger.getLogger(JdkHttpTransport.class.getName());

    private final HttpClient httpClient;

    public JdkHttpTransport(ClientConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(config.timeout())
            .followRedirects(HttpClient.Redirect.NORMAL);
        if (!config.verifyTls()) {
            LOG.warning("TLS certificate verification is disabled for " + config.baseUrl());
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();
    }

    @Override
    public HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = {
            new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS not available", e);
        }
    }
}
