package com.bastion.security;

import java.util.Set;

/**
 * Port to the external identity provider that owns principals and their group memberships.
 * <p>
 * Implementations are constructed once at startup and shared by all requests, so they must be
 * thread-safe. Both calls block and must be bounded by a timeout configured on the underlying
 * client; implementations never retry.
 */
public interface IdentityProvider {

    /**
     * Resolves an access token to the name of the principal it was issued to.
     *
     * @param accessToken raw bearer token
     * @return the principal name
     * @throws TokenRejectedException    if the provider rejects the token
     * @throws IdentityProviderException on any other provider error
     */
    String introspect(String accessToken);

    /**
     * Lists the groups the principal belongs to.
     *
     * @param principalName name returned by {@link #introspect(String)}
     * @return group names, empty if the principal belongs to none
     * @throws IdentityProviderException on any provider error
     */
    Set<String> listGroups(String principalName);
}
