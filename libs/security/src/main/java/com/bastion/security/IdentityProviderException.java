package com.bastion.security;

/**
 * Thrown by an {@link IdentityProvider} when it cannot answer: network failure, timeout,
 * throttling, misconfiguration. The message is the provider's own error text.
 */
public class IdentityProviderException extends RuntimeException {

    public IdentityProviderException(String message) {
        super(message);
    }

    public IdentityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
