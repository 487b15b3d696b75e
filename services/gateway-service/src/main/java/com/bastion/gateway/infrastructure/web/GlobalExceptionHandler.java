package com.bastion.gateway.infrastructure.web;

import com.bastion.gateway.domain.GatewayError;
import com.bastion.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders gateway failures as RFC 7807 {@link ProblemDetail} documents.
 *
 * <pre>
 * {
 *   "type": "https://bastion.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Authorization header is missing",
 *   "error": "auth_header_missing",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>The controller uses {@link #toProblem(GatewayError, String)} for failures reported by the
 * orchestrator; the handler below covers anything thrown before the orchestrator runs.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://bastion.dev/errors/";

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return toResponse(GatewayError.INTERNAL_UNEXPECTED, "Internal server error: " + ex.getMessage());
    }

    /**
     * Builds the problem document for a gateway error, stamped with the current correlation ID.
     */
    public static ProblemDetail toProblem(GatewayError error, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatusCode.valueOf(error.status()), detail);
        problem.setTitle(error.title());
        problem.setType(URI.create(ERROR_TYPE_BASE + error.slug()));
        problem.setProperty("error", error.name().toLowerCase(Locale.ROOT));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    /**
     * {@link #toProblem(GatewayError, String)} wrapped in a response with the problem media type.
     */
    public static ResponseEntity<ProblemDetail> toResponse(GatewayError error, String detail) {
        return ResponseEntity.status(error.status())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(toProblem(error, detail));
    }
}
