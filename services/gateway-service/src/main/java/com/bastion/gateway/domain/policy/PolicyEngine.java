package com.bastion.gateway.domain.policy;

import com.bastion.security.GroupChecker;
import com.bastion.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * First-match-wins evaluation of an ordered {@link PolicyRule} list.
 * <p>
 * The last rule must be a catch-all (empty prefix), so every path matches some rule and
 * {@link #evaluate} always produces a decision. Only the first matching rule is consulted:
 * a denial there is final even if a later rule would allow the request.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final List<PolicyRule> rules;

    public PolicyEngine(List<PolicyRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("rules must not be null or empty");
        }
        if (!rules.get(rules.size() - 1).isCatchAll()) {
            throw new IllegalArgumentException(
                    "last rule must have an empty path prefix so that every path matches");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Decides whether the principal may access the path and which backend serves it.
     *
     * @param path      request path without query string
     * @param principal authenticated principal
     * @param deviceId  device id presented by the request, null when absent
     * @return the decision of the first rule whose prefix matches
     */
    public Decision evaluate(String path, Principal principal, String deviceId) {
        String matchPath = path == null ? "" : path;
        for (PolicyRule rule : rules) {
            if (rule.matches(matchPath)) {
                Decision decision = apply(rule, principal, deviceId);
                log.debug("Path {} matched rule '{}': {}", matchPath, rule.pathPrefix(), decision);
                return decision;
            }
        }
        // unreachable while the constructor guarantees a trailing catch-all
        throw new IllegalStateException("No policy rule matched " + matchPath);
    }

    private static Decision apply(PolicyRule rule, Principal principal, String deviceId) {
        if (!GroupChecker.isMemberOfAny(principal, rule.requiredGroups())) {
            return Decision.deny(DenyReason.INSUFFICIENT_GROUP);
        }
        if (rule.requiredDeviceId() != null && !rule.requiredDeviceId().equals(deviceId)) {
            return Decision.deny(DenyReason.UNTRUSTED_DEVICE);
        }
        return Decision.allow(rule.target());
    }
}
