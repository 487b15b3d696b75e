package com.bastion.gateway.infrastructure.web;

import com.bastion.gateway.config.GatewayProperties;
import com.bastion.gateway.domain.forward.InboundRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts a servlet request into the gateway's {@link InboundRequest}.
 *
 * <p>Repeated headers are joined with {@code ", "}, except {@code Cookie}, which is joined with
 * {@code "; "}. A body is treated as base64 text when the
 * request carries {@code Content-Transfer-Encoding: base64}.
 */
@Component
public class InboundRequestMapper {

    static final String TRANSFER_ENCODING_HEADER = "Content-Transfer-Encoding";
    static final String COOKIE_HEADER = "Cookie";

    private final String deviceIdHeader;

    public InboundRequestMapper(GatewayProperties properties) {
        this.deviceIdHeader = properties.deviceIdHeader();
    }

    public InboundRequest map(HttpServletRequest request, byte[] body) {
        String path = request.getRequestURI();
        if (request.getQueryString() != null) {
            path = path + "?" + request.getQueryString();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            List<String> values = new ArrayList<>(Collections.list(request.getHeaders(name)));
            headers.put(name, String.join(COOKIE_HEADER.equalsIgnoreCase(name) ? "; " : ", ", values));
        }

        String encoding = request.getHeader(TRANSFER_ENCODING_HEADER);
        boolean base64 = encoding != null && "base64".equalsIgnoreCase(encoding.trim());

        return new InboundRequest(
                request.getMethod(), path, headers, body, base64, request.getHeader(deviceIdHeader));
    }
}
