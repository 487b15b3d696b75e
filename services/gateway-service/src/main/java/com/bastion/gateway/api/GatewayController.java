package com.bastion.gateway.api;

import com.bastion.gateway.domain.GatewayOrchestrator;
import com.bastion.gateway.domain.GatewayResult;
import com.bastion.gateway.domain.forward.OutboundResult;
import com.bastion.gateway.infrastructure.web.GlobalExceptionHandler;
import com.bastion.gateway.infrastructure.web.InboundRequestMapper;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single entry point for every proxied request, any method and any path outside
 * {@code /actuator}. Actuator endpoints are served by their own handler mapping, which takes
 * precedence over this catch-all.
 */
@RestController
public class GatewayController {

    /** Response framing is the container's job; these backend headers are not relayed. */
    static final Set<String> HOP_BY_HOP_HEADERS =
            Set.of("transfer-encoding", "connection", "keep-alive", "content-length");

    private final GatewayOrchestrator orchestrator;
    private final InboundRequestMapper requestMapper;

    public GatewayController(GatewayOrchestrator orchestrator, InboundRequestMapper requestMapper) {
        this.orchestrator = orchestrator;
        this.requestMapper = requestMapper;
    }

    @RequestMapping("/**")
    public ResponseEntity<?> proxy(HttpServletRequest request) throws IOException {
        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
        GatewayResult result = orchestrator.handle(requestMapper.map(request, body));

        if (!result.isForwarded()) {
            return GlobalExceptionHandler.toResponse(result.error(), result.detail());
        }
        OutboundResult response = result.response();
        return ResponseEntity.status(response.statusCode())
                .headers(relayHeaders(response.headers()))
                .body(response.body());
    }

    static HttpHeaders relayHeaders(Map<String, List<String>> backendHeaders) {
        HttpHeaders headers = new HttpHeaders();
        backendHeaders.forEach((name, values) -> {
            if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                headers.addAll(name, values);
            }
        });
        return headers;
    }
}
