package com.bastion.security;

/**
 * Reasons a bearer credential can fail authentication. All of them map to HTTP 401.
 */
public enum AuthenticationFailure {

    /** No Authorization header on the request. */
    MISSING_HEADER("Authorization header is missing"),

    /** Authorization header present but not of the form {@code Bearer <token>}. */
    MALFORMED_HEADER("Invalid Authorization header format"),

    /** The identity provider rejected the token. */
    INVALID_TOKEN("Invalid token");

    private final String message;

    AuthenticationFailure(String message) {
        this.message = message;
    }

    /** Caller-facing message. */
    public String message() {
        return message;
    }
}
