package com.bastion.security;

/**
 * Thrown when a request cannot be authenticated.
 * <p>
 * Carries the {@link AuthenticationFailure} so callers can map it to a response without
 * parsing messages. Identity-provider outages are not authentication failures; they surface as
 * {@link IdentityProviderException}.
 */
public class AuthenticationException extends RuntimeException {

    private final AuthenticationFailure failure;

    public AuthenticationException(AuthenticationFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public AuthenticationException(AuthenticationFailure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public AuthenticationFailure failure() {
        return failure;
    }
}
