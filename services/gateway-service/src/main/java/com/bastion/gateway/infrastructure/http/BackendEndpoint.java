package com.bastion.gateway.infrastructure.http;

import java.time.Duration;

/**
 * Where a target's backend lives and how long the gateway waits for it.
 *
 * @param baseUrl scheme, host and optional base path; blank or null when not configured
 * @param timeout bound on connecting and on waiting for the response
 */
public record BackendEndpoint(String baseUrl, Duration timeout) {

    public BackendEndpoint {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (baseUrl != null) {
            baseUrl = baseUrl.strip();
            while (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
        }
    }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isEmpty();
    }
}
