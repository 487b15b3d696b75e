package com.bastion.gateway.infrastructure.http;

import com.bastion.gateway.domain.GatewayError;
import com.bastion.gateway.domain.GatewayException;
import com.bastion.gateway.domain.forward.InboundRequest;
import com.bastion.gateway.domain.forward.OutboundResult;
import com.bastion.gateway.domain.forward.RequestForwarder;
import com.bastion.gateway.domain.policy.Target;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.Base64;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * {@link RequestForwarder} that relays requests over HTTP with one {@link RestClient} per target.
 *
 * <p>Each target gets its own JDK {@link HttpClient} whose connect timeout and per-request
 * response timeout are the target's configured timeout. The outbound request is:
 *
 * <ul>
 *   <li>URL: target base URL + original path, query string included
 *   <li>headers: all inbound headers except {@code Host} and {@code Authorization}, plus the
 *       correlation ID; connection-framing headers are left to the client
 *   <li>body: base64-decoded when the inbound body was transport-encoded, otherwise as received
 * </ul>
 *
 * <p>The backend's status, headers and body come back untouched, 4xx and 5xx included. Only
 * failures to get an answer at all become gateway errors.
 */
public class HttpRequestForwarder implements RequestForwarder {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestForwarder.class);

    static final String FORWARD_TIMER = "gateway.forward.duration";

    /** Never copied to the backend: the caller's credential and the gateway's own host. */
    static final Set<String> STRIPPED_HEADERS = Set.of("host", "authorization");

    private static final String TRANSFER_ENCODING_HEADER = "content-transfer-encoding";

    /** Framing headers the HTTP client computes itself for the outbound connection. */
    private static final Set<String> FRAMING_HEADERS =
            Set.of("connection", "content-length", "expect", "transfer-encoding", "upgrade");

    private final Map<Target, Route> routes = new EnumMap<>(Target.class);
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    /**
     * @param endpoints base URL and timeout per target; a target may be missing or unconfigured
     * @param builder   template for the per-target clients (cloned, never mutated)
     * @param metrics   meter factory for forward latency
     */
    public HttpRequestForwarder(
            Map<Target, BackendEndpoint> endpoints, RestClient.Builder builder, MetricFactory metrics) {
        this.metrics = metrics;
        endpoints.forEach((target, endpoint) -> routes.put(target, new Route(endpoint, client(builder, endpoint))));
    }

    @Override
    public OutboundResult forward(InboundRequest request, Target target) {
        Route route = routes.get(target);
        if (route == null || !route.endpoint().isConfigured()) {
            throw new GatewayException(
                    GatewayError.CONFIGURATION_MISSING,
                    "Internal server error: no backend URL configured for target "
                            + target.name().toLowerCase(Locale.ROOT));
        }

        URI uri;
        byte[] body;
        try {
            uri = URI.create(route.endpoint().baseUrl() + request.path());
            body = request.base64Encoded() ? Base64.getDecoder().decode(request.body()) : request.body();
        } catch (IllegalArgumentException e) {
            throw new GatewayException(
                    GatewayError.INTERNAL_UNEXPECTED, "Internal server error: " + e.getMessage(), e);
        }
        HttpHeaders headers = outboundHeaders(request);
        if (log.isDebugEnabled()) {
            log.debug("Forwarding {} {} with headers {}", request.method(), uri, redactor.redact(headers.toSingleValueMap()));
        }

        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return send(route.client(), HttpMethod.valueOf(request.method()), uri, headers, body);
        } catch (ResourceAccessException e) {
            log.warn("Backend {} unreachable for {} {}: {}", target, request.method(), uri, e.getMessage());
            throw new GatewayException(GatewayError.BAD_GATEWAY, "Bad gateway: " + causeText(e), e);
        } catch (RuntimeException e) {
            throw new GatewayException(
                    GatewayError.INTERNAL_UNEXPECTED, "Internal server error: " + e.getMessage(), e);
        } finally {
            sample.stop(metrics.timer(FORWARD_TIMER, "Backend round-trip latency",
                    "target", target.name().toLowerCase(Locale.ROOT)));
        }
    }

    /**
     * Copies the inbound headers minus the stripped and framing ones. A decoded body no longer
     * carries its transfer encoding. Package-private for testing.
     */
    static HttpHeaders outboundHeaders(InboundRequest request) {
        HttpHeaders headers = new HttpHeaders();
        request.headers().forEach((name, value) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            boolean decoded = request.base64Encoded() && TRANSFER_ENCODING_HEADER.equals(lower);
            if (!STRIPPED_HEADERS.contains(lower) && !FRAMING_HEADERS.contains(lower) && !decoded) {
                headers.add(name, value);
            }
        });
        if (!headers.containsKey(CorrelationContext.CORRELATION_ID_HEADER)) {
            CorrelationContextHolder.get().ifPresent(
                    ctx -> headers.set(CorrelationContext.CORRELATION_ID_HEADER, ctx.correlationId()));
        }
        return headers;
    }

    /** Root cause text only; the wrapper message names the backend URL. */
    static String causeText(ResourceAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static OutboundResult send(
            RestClient client, HttpMethod method, URI uri, HttpHeaders headers, byte[] body) {
        RestClient.RequestBodySpec spec = client.method(method)
                .uri(uri)
                .headers(outbound -> outbound.addAll(headers));
        if (body.length > 0) {
            spec.body(body);
        }
        return spec.exchange((clientRequest, clientResponse) -> {
            Map<String, List<String>> responseHeaders = new LinkedHashMap<>();
            clientResponse.getHeaders().forEach((name, values) -> responseHeaders.put(name, List.copyOf(values)));
            return new OutboundResult(
                    clientResponse.getStatusCode().value(),
                    responseHeaders,
                    StreamUtils.copyToByteArray(clientResponse.getBody()));
        });
    }

    private static RestClient client(RestClient.Builder builder, BackendEndpoint endpoint) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(endpoint.timeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(endpoint.timeout());
        return builder.clone().requestFactory(requestFactory).build();
    }

    private record Route(BackendEndpoint endpoint, RestClient client) {
    }
}
