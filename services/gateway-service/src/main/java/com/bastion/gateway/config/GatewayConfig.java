package com.bastion.gateway.config;

import com.bastion.gateway.domain.GatewayOrchestrator;
import com.bastion.gateway.domain.forward.RequestForwarder;
import com.bastion.gateway.domain.policy.PolicyEngine;
import com.bastion.gateway.domain.policy.PolicyRule;
import com.bastion.gateway.domain.policy.Target;
import com.bastion.gateway.infrastructure.http.BackendEndpoint;
import com.bastion.gateway.infrastructure.http.HttpRequestForwarder;
import com.bastion.observability.MetricFactory;
import com.bastion.security.CredentialValidator;
import com.bastion.security.IdentityProvider;
import com.bastion.security.cognito.CognitoIdentityProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;

/**
 * Wires the gateway pipeline. Every collaborator is built once here and injected; none of them
 * holds per-request state.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean(destroyMethod = "close")
    public CognitoIdentityProviderClient cognitoIdentityProviderClient(GatewayProperties properties) {
        var identity = properties.identity();
        log.info("Using Cognito user pool {} (client {}) in {}",
                identity.userPoolId(), identity.clientId(), identity.region());
        return CognitoIdentityProviderClient.builder()
                .region(Region.of(identity.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(identity.timeout())
                        .retryPolicy(RetryPolicy.none())
                        .build())
                .build();
    }

    @Bean
    public IdentityProvider identityProvider(
            CognitoIdentityProviderClient client, GatewayProperties properties) {
        return new CognitoIdentityProvider(client, properties.identity().userPoolId());
    }

    @Bean
    public CredentialValidator credentialValidator(IdentityProvider identityProvider) {
        return new CredentialValidator(identityProvider);
    }

    @Bean
    public PolicyEngine policyEngine(GatewayProperties properties) {
        var rules = properties.policyRules();
        for (PolicyRule rule : rules) {
            log.info("Policy rule: prefix='{}' groups={} device={} -> {}",
                    rule.pathPrefix(), rule.requiredGroups(), rule.requiredDeviceId(), rule.target());
        }
        return new PolicyEngine(rules);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public RequestForwarder requestForwarder(
            GatewayProperties properties, RestClient.Builder restClientBuilder, MetricFactory metrics) {
        Map<Target, BackendEndpoint> endpoints = new EnumMap<>(Target.class);
        properties.backends().forEach((target, backend) -> {
            endpoints.put(target, new BackendEndpoint(backend.baseUrl(), backend.timeout()));
            if (backend.baseUrl() == null || backend.baseUrl().isBlank()) {
                log.warn("No base URL configured for {} backend; requests routed there will fail", target);
            }
        });
        return new HttpRequestForwarder(endpoints, restClientBuilder, metrics);
    }

    @Bean
    public GatewayOrchestrator gatewayOrchestrator(
            CredentialValidator credentialValidator,
            PolicyEngine policyEngine,
            RequestForwarder requestForwarder,
            MetricFactory metrics) {
        return new GatewayOrchestrator(credentialValidator, policyEngine, requestForwarder, metrics);
    }
}
