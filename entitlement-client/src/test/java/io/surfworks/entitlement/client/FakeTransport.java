package io.surfworks.entitlement.client;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transport that replays queued responses and records every request.
 */
class FakeTransport implements HttpTransport {

    private final Deque<Object> replies = new ArrayDeque<>();
    final List<HttpRequest> requests = new ArrayList<>();

    FakeTransport reply(int status, String body) {
        replies.add(new Reply(status, body));
        return this;
    }

    FakeTransport fail(IOException e) {
        replies.add(e);
        return this;
    }

    @Override
    public HttpResponse<String> send(HttpRequest request) throws IOException {
        requests.add(request);
        Object next = replies.poll();
        if (next == null) {
            throw new IllegalStateException("No reply queued for " + request.uri());
        }
        if (next instanceof IOException e) {
            throw e;
        }
        Reply reply = (Reply) next;
        return new FakeResponse(request, reply.status, reply.body);
    }

    HttpRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private record Reply(int status, String body) {}

    private record FakeResponse(HttpRequest request, int status, String body) implements HttpResponse<String> {

        @Override
        public int statusCode() {
            return status;
        }

        @Override
        public Optional<HttpResponse<String>> previousResponse() {
            return Optional.empty();
        }

        @Override
        public HttpHeaders headers() {
            return HttpHeaders.of(Map.of("Content-Type", List.of("application/json")), (k, v) -> true);
        }

        @Override
        public Optional<SSLSession> sslSession() {
            return Optional.empty();
        }

        @Override
        public URI uri() {
            return request.uri();
        }

        @Override
        public HttpClient.Version version() {
            return HttpClient.Version.HTTP_1_1;
        }
    }
}
