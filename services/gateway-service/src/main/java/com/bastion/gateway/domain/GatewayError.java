package com.bastion.gateway.domain;

import com.bastion.security.AuthenticationFailure;

/**
 * Every way a gateway request can end without a backend response, with its HTTP status.
 */
public enum GatewayError {

    AUTH_HEADER_MISSING(401, "Unauthorized", "unauthorized"),
    AUTH_HEADER_MALFORMED(401, "Unauthorized", "unauthorized"),
    INVALID_TOKEN(401, "Unauthorized", "unauthorized"),
    POLICY_DENIED(403, "Forbidden", "forbidden"),
    CONFIGURATION_MISSING(500, "Internal Server Error", "configuration"),
    BAD_GATEWAY(502, "Bad Gateway", "bad-gateway"),
    INTERNAL_UNEXPECTED(500, "Internal Server Error", "internal");

    private final int status;
    private final String title;
    private final String slug;

    GatewayError(int status, String title, String slug) {
        this.status = status;
        this.title = title;
        this.slug = slug;
    }

    public int status() {
        return status;
    }

    public String title() {
        return title;
    }

    /** Last segment of the problem type URI. */
    public String slug() {
        return slug;
    }

    /** Maps a credential failure onto the gateway taxonomy. */
    public static GatewayError from(AuthenticationFailure failure) {
        return switch (failure) {
            case MISSING_HEADER -> AUTH_HEADER_MISSING;
            case MALFORMED_HEADER -> AUTH_HEADER_MALFORMED;
            case INVALID_TOKEN -> INVALID_TOKEN;
        };
    }
}
