package com.bastion.gateway.infrastructure.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-process HTTP backend on a loopback port. Records every request it receives and answers
 * with a configurable status, headers and body, optionally after a delay.
 */
public final class StubBackend implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private volatile int status = 200;
    private volatile byte[] responseBody = "{\"ok\":true}".getBytes();
    private volatile Map<String, String> responseHeaders = Map.of("Content-Type", "application/json");
    private volatile Duration delay = Duration.ZERO;

    private StubBackend() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    public static StubBackend start() throws IOException {
        return new StubBackend();
    }

    public String baseUrl() {
        return "http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":"
                + server.getAddress().getPort();
    }

    public StubBackend respondWith(int status, String body, Map<String, String> headers) {
        this.status = status;
        this.responseBody = body.getBytes();
        this.responseHeaders = Map.copyOf(headers);
        return this;
    }

    public StubBackend delayResponsesBy(Duration delay) {
        this.delay = delay;
        return this;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public RecordedRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new AssertionError("backend received no request");
        }
        return requests.get(requests.size() - 1);
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            byte[] body;
            try (InputStream in = exchange.getRequestBody()) {
                body = in.readAllBytes();
            }
            Map<String, List<String>> headers = new LinkedHashMap<>();
            exchange.getRequestHeaders().forEach(
                    (name, values) -> headers.put(name.toLowerCase(Locale.ROOT), List.copyOf(values)));
            String uri = exchange.getRequestURI().getRawPath();
            if (exchange.getRequestURI().getRawQuery() != null) {
                uri = uri + "?" + exchange.getRequestURI().getRawQuery();
            }
            requests.add(new RecordedRequest(exchange.getRequestMethod(), uri, headers, body));

            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }

            responseHeaders.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
            byte[] answer = responseBody;
            exchange.sendResponseHeaders(status, answer.length == 0 ? -1 : answer.length);
            if (answer.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(answer);
                }
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * One request as the backend saw it. Header names are lower-cased.
     */
    public record RecordedRequest(String method, String uri, Map<String, List<String>> headers, byte[] body) {

        public String header(String name) {
            List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
            return values == null || values.isEmpty() ? null : values.get(0);
        }

        public String bodyText() {
            return new String(body);
        }
    }
}
