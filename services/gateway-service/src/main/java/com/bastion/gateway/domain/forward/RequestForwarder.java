package com.bastion.gateway.domain.forward;

import com.bastion.gateway.domain.GatewayException;
import com.bastion.gateway.domain.policy.Target;

/**
 * Port for relaying an allowed request to the backend selected by policy.
 */
public interface RequestForwarder {

    /**
     * Sends the request to the target backend and returns its response as-is.
     *
     * @param request the inbound request
     * @param target  backend chosen by the policy engine
     * @return the backend's status, headers and body
     * @throws GatewayException with {@code CONFIGURATION_MISSING} when the target has no base URL,
     *                          {@code BAD_GATEWAY} on network or timeout failures,
     *                          {@code INTERNAL_UNEXPECTED} on anything else
     */
    OutboundResult forward(InboundRequest request, Target target);
}
