package com.bastion.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.gateway.domain.GatewayError;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("renders an authentication failure as 401 problem detail")
    void unauthorized() {
        ProblemDetail problem = GlobalExceptionHandler.toProblem(
                GatewayError.AUTH_HEADER_MISSING, "Authorization header is missing");

        assertThat(problem.getStatus()).isEqualTo(401);
        assertThat(problem.getTitle()).isEqualTo("Unauthorized");
        assertThat(problem.getDetail()).isEqualTo("Authorization header is missing");
        assertThat(problem.getType().toString()).isEqualTo("https://bastion.dev/errors/unauthorized");
        assertThat(problem.getProperties())
                .containsEntry("error", "auth_header_missing")
                .containsKey("timestamp");
    }

    @Test
    @DisplayName("includes the correlation ID when one is set")
    void correlationId() {
        CorrelationContextHolder.set(new CorrelationContext("corr-77", null, null));

        ProblemDetail problem = GlobalExceptionHandler.toProblem(GatewayError.BAD_GATEWAY, "Bad gateway: x");

        assertThat(problem.getStatus()).isEqualTo(502);
        assertThat(problem.getProperties()).containsEntry("correlationId", "corr-77");
    }

    @Test
    @DisplayName("omits the correlation ID when none is set")
    void noCorrelationId() {
        ProblemDetail problem = GlobalExceptionHandler.toProblem(GatewayError.POLICY_DENIED, "Access denied");

        assertThat(problem.getProperties()).doesNotContainKey("correlationId");
    }

    @Test
    @DisplayName("maps anything thrown outside the orchestrator to 500 problem+json")
    void generic() {
        var response = handler.handleGeneric(new UncheckedIOException(new IOException("stream closed")));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(response.getBody().getDetail()).startsWith("Internal server error: ");
        assertThat(response.getBody().getProperties()).containsEntry("error", "internal_unexpected");
    }
}
