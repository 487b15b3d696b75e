package com.bastion.security;

import java.util.Set;

/**
 * The authenticated identity resolved from a bearer credential, with its group memberships.
 * <p>
 * Produced once per request by {@link CredentialValidator}; never persisted. The group set is
 * copied on construction so the principal stays immutable whatever the provider hands back.
 *
 * @param name   principal name as reported by the identity provider (e.g. the Cognito username)
 * @param groups group memberships, possibly empty
 */
public record Principal(String name, Set<String> groups) {

    public Principal {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    /** Creates a principal without group memberships. */
    public static Principal of(String name) {
        return new Principal(name, Set.of());
    }
}
