package com.bastion.gateway.domain.policy;

import java.util.List;
import java.util.Set;

/**
 * The built-in rule table, used when configuration supplies none.
 */
public final class PolicyRules {

    public static final String ADMIN_GROUP = "admin";
    public static final String TRUSTED_DEVICE_ID = "trusted-device-123";

    private PolicyRules() {
        // constants
    }

    /**
     * {@code /protectedPath} for admins, {@code /admin-panel} for admins on the trusted device,
     * everything else to the default backend.
     */
    public static List<PolicyRule> defaults() {
        return List.of(
                new PolicyRule("/protectedPath", Set.of(ADMIN_GROUP), null, Target.PROTECTED),
                new PolicyRule("/admin-panel", Set.of(ADMIN_GROUP), TRUSTED_DEVICE_ID, Target.PROTECTED),
                PolicyRule.catchAll(Target.DEFAULT));
    }
}
