package com.bastion.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization header values.
 * <p>
 * The accepted form is exactly {@code "Bearer <token>"}: one scheme, one single space, one
 * non-empty token. The scheme compares case-insensitively. Anything else (no space, extra
 * spaces, another scheme, trailing parts) is malformed.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing/malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String[] parts = authorizationHeader.split(" ", -1);
        if (parts.length != 2 || !SCHEME.equalsIgnoreCase(parts[0])) {
            return Optional.empty();
        }
        String token = parts[1];
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
