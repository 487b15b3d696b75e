package com.bastion.gateway.domain.forward;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the backend answered: relayed to the caller unchanged.
 *
 * @param statusCode backend status code, whatever its class
 * @param headers    backend response headers, multi-valued
 * @param body       backend response body, never null
 */
public record OutboundResult(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public OutboundResult {
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }
}
