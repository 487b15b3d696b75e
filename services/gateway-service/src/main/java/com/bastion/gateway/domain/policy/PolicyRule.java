package com.bastion.gateway.domain.policy;

import java.util.Objects;
import java.util.Set;

/**
 * One row of the gateway's rule table.
 * <p>
 * A rule matches every path that starts with {@code pathPrefix}; an empty prefix matches
 * everything and marks the default rule. Once matched, the principal must belong to at least
 * one of {@code requiredGroups} (when non-empty) and the request must carry exactly
 * {@code requiredDeviceId} (when set).
 *
 * @param pathPrefix       literal path prefix, empty for the default rule
 * @param requiredGroups   groups of which the principal needs at least one; empty = no requirement
 * @param requiredDeviceId device id the request must present; null = no requirement
 * @param target           backend to forward to when the rule allows the request
 */
public record PolicyRule(
        String pathPrefix,
        Set<String> requiredGroups,
        String requiredDeviceId,
        Target target
) {

    public PolicyRule {
        Objects.requireNonNull(target, "target");
        pathPrefix = pathPrefix == null ? "" : pathPrefix;
        requiredGroups = requiredGroups == null ? Set.of() : Set.copyOf(requiredGroups);
        if (requiredDeviceId != null && requiredDeviceId.isBlank()) {
            requiredDeviceId = null;
        }
    }

    /**
     * The always-matching rule with no requirements.
     */
    public static PolicyRule catchAll(Target target) {
        return new PolicyRule("", Set.of(), null, target);
    }

    /** Whether this rule applies to the given path (query string already removed). */
    public boolean matches(String path) {
        return path.startsWith(pathPrefix);
    }

    /** Whether this rule is the always-matching default. */
    public boolean isCatchAll() {
        return pathPrefix.isEmpty();
    }
}
