package com.bastion.gateway.domain.policy;

import java.util.Objects;

/**
 * Outcome of evaluating the rule table for one request: either {@link Allow} with the backend
 * to forward to, or {@link Deny} with the reason.
 */
public sealed interface Decision permits Decision.Allow, Decision.Deny {

    static Decision allow(Target target) {
        return new Allow(target);
    }

    static Decision deny(DenyReason reason) {
        return new Deny(reason);
    }

    /**
     * @param target backend selected by the matching rule
     */
    record Allow(Target target) implements Decision {

        public Allow {
            Objects.requireNonNull(target, "target");
        }
    }

    /**
     * @param reason the condition of the matching rule that failed
     */
    record Deny(DenyReason reason) implements Decision {

        public Deny {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
