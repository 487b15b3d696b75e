package com.bastion.gateway.domain.forward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A request as it arrived at the gateway, independent of the servlet API.
 *
 * @param method        HTTP method, e.g. {@code GET}
 * @param path          path including the query string when there is one
 * @param headers       inbound headers in arrival order; multiple values already joined
 * @param body          raw body bytes, never null
 * @param base64Encoded whether {@code body} is base64 text that must be decoded before forwarding
 * @param deviceId      device attribute read from the device header, null when absent
 */
public record InboundRequest(
        String method,
        String path,
        Map<String, String> headers,
        byte[] body,
        boolean base64Encoded,
        String deviceId
) {

    public InboundRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    /**
     * Case-insensitive header lookup.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /** The path with any query string removed. */
    public String pathWithoutQuery() {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }
}
