package com.bastion.gateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code bastion.service.*}.
 *
 * <pre>
 * bastion:
 *   service:
 *     name: bastion-gateway
 *     environment: production
 * </pre>
 *
 * @param name        service name used in logs and as the {@code service} metric tag. Required.
 * @param environment deployment environment (development, staging, production).
 */
@ConfigurationProperties(prefix = "bastion.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    /**
     * Compact constructor: applies defaults for optional fields before Bean Validation runs.
     */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
