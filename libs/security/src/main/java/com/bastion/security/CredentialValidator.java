package com.bastion.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Turns a raw {@code Authorization} header into a {@link Principal}.
 * <p>
 * Steps: reject a missing header, reject a header that is not {@code Bearer <token>}, ask the
 * {@link IdentityProvider} who the token belongs to, then fetch that principal's groups.
 * Nothing is cached; every request is validated on its own.
 */
public class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private final IdentityProvider identityProvider;

    public CredentialValidator(IdentityProvider identityProvider) {
        if (identityProvider == null) {
            throw new IllegalArgumentException("identityProvider must not be null");
        }
        this.identityProvider = identityProvider;
    }

    /**
     * Validates the credential and resolves the principal.
     *
     * @param authorizationHeader raw header value, null when the request has none
     * @return the authenticated principal with its groups
     * @throws AuthenticationException   if the header is missing, malformed or the token is rejected
     * @throws IdentityProviderException if the provider fails for any other reason
     */
    public Principal validate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new AuthenticationException(AuthenticationFailure.MISSING_HEADER);
        }
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new AuthenticationException(AuthenticationFailure.MALFORMED_HEADER));

        String name;
        try {
            name = identityProvider.introspect(token);
        } catch (TokenRejectedException e) {
            log.info("Identity provider rejected token: {}", e.getMessage());
            throw new AuthenticationException(AuthenticationFailure.INVALID_TOKEN, e);
        }

        Set<String> groups = identityProvider.listGroups(name);
        log.debug("Authenticated principal {} with groups {}", name, groups);
        return new Principal(name, groups);
    }
}
