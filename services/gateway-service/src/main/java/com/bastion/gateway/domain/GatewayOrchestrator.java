package com.bastion.gateway.domain;

import com.bastion.gateway.domain.forward.InboundRequest;
import com.bastion.gateway.domain.forward.OutboundResult;
import com.bastion.gateway.domain.forward.RequestForwarder;
import com.bastion.gateway.domain.policy.Decision;
import com.bastion.gateway.domain.policy.PolicyEngine;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import com.bastion.security.AuthenticationException;
import com.bastion.security.CredentialValidator;
import com.bastion.security.IdentityProviderException;
import com.bastion.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Runs one request through authentication, authorization and forwarding.
 * <p>
 * Each step either hands over to the next or ends the request with a {@link GatewayResult}
 * failure; nothing is retried and nothing is kept between requests. No exception escapes
 * {@link #handle(InboundRequest)}.
 */
public class GatewayOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GatewayOrchestrator.class);

    public static final String AUTHORIZATION_HEADER = "Authorization";
    static final String REQUESTS_METRIC = "gateway.requests";

    private final CredentialValidator credentialValidator;
    private final PolicyEngine policyEngine;
    private final RequestForwarder requestForwarder;
    private final MetricFactory metrics;

    public GatewayOrchestrator(
            CredentialValidator credentialValidator,
            PolicyEngine policyEngine,
            RequestForwarder requestForwarder,
            MetricFactory metrics) {
        this.credentialValidator = credentialValidator;
        this.policyEngine = policyEngine;
        this.requestForwarder = requestForwarder;
        this.metrics = metrics;
    }

    /**
     * Handles one inbound request end to end.
     *
     * @param request the inbound request
     * @return the backend response, or the failure that ended the request
     */
    public GatewayResult handle(InboundRequest request) {
        GatewayResult result;
        try {
            result = authenticateAuthorizeAndForward(request);
        } catch (AuthenticationException e) {
            log.info("Rejected {} {}: {}", request.method(), request.pathWithoutQuery(), e.getMessage());
            result = GatewayResult.failed(GatewayError.from(e.failure()), e.getMessage());
        } catch (IdentityProviderException e) {
            log.error("Identity provider failure: {}", e.getMessage(), e);
            result = GatewayResult.failed(
                    GatewayError.INTERNAL_UNEXPECTED, "Internal server error: " + e.getMessage());
        } catch (GatewayException e) {
            log.warn("Request {} {} failed with {}: {}",
                    request.method(), request.pathWithoutQuery(), e.error(), e.getMessage());
            result = GatewayResult.failed(e.error(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected gateway failure", e);
            result = GatewayResult.failed(
                    GatewayError.INTERNAL_UNEXPECTED, "Internal server error: " + e.getMessage());
        }
        count(result);
        return result;
    }

    private GatewayResult authenticateAuthorizeAndForward(InboundRequest request) {
        Principal principal = credentialValidator.validate(
                request.header(AUTHORIZATION_HEADER).orElse(null));
        CorrelationContextHolder.bindUser(principal.name());

        Decision decision = policyEngine.evaluate(request.pathWithoutQuery(), principal, request.deviceId());
        if (decision instanceof Decision.Deny deny) {
            log.warn("Denied {} {} for {}: {}", request.method(), request.pathWithoutQuery(),
                    principal.name(), deny.reason());
            return GatewayResult.failed(
                    GatewayError.POLICY_DENIED, "Access denied: " + deny.reason().description());
        }

        var target = ((Decision.Allow) decision).target();
        OutboundResult response = requestForwarder.forward(request, target);
        log.info("Forwarded {} {} for {} to {} -> {}", request.method(), request.pathWithoutQuery(),
                principal.name(), target, response.statusCode());
        return GatewayResult.forwarded(response, target);
    }

    private void count(GatewayResult result) {
        String outcome = result.isForwarded()
                ? "forwarded"
                : result.error().name().toLowerCase(Locale.ROOT);
        metrics.counter(REQUESTS_METRIC, "Gateway requests by outcome", "outcome", outcome).increment();
    }
}
