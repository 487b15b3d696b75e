package com.bastion.security;

/**
 * Thrown by {@link IdentityProvider#introspect(String)} when the provider answered and the
 * token is not authorized (expired, revoked, forged, issued for another pool).
 */
public class TokenRejectedException extends IdentityProviderException {

    public TokenRejectedException(String message) {
        super(message);
    }

    public TokenRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
