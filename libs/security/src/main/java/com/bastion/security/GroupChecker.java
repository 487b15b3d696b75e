package com.bastion.security;

import java.util.Collection;

/**
 * Group membership checks against a {@link Principal}.
 */
public final class GroupChecker {

    private GroupChecker() {
        // utility class
    }

    /**
     * Checks whether the principal belongs to the given group.
     */
    public static boolean isMemberOf(Principal principal, String group) {
        return principal.groups().contains(group);
    }

    /**
     * Checks whether the principal belongs to ANY of the required groups.
     * An empty requirement is vacuously satisfied.
     */
    public static boolean isMemberOfAny(Principal principal, Collection<String> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        for (String group : required) {
            if (isMemberOf(principal, group)) {
                return true;
            }
        }
        return false;
    }
}
