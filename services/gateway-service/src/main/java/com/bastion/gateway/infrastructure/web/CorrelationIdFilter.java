package com.bastion.gateway.infrastructure.web;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every inbound request.
 *
 * <p>The ID flows from the {@code X-Correlation-ID} request header (or a fresh UUID) into
 * {@link CorrelationContextHolder}, and from there into the SLF4J MDC, the header forwarded to
 * the backend and the {@code correlationId} field of error bodies. It is echoed on the response.
 * Each request also gets its own request ID.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the context exists for every later filter
 * and handler.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, null, UUID.randomUUID().toString()));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
