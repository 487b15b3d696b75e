package com.bastion.gateway.domain;

import com.bastion.gateway.domain.forward.OutboundResult;
import com.bastion.gateway.domain.policy.Target;

import java.util.Objects;

/**
 * Terminal state of one gateway request: the backend response, or the error that stopped it.
 *
 * @param response backend response when forwarded, otherwise null
 * @param target   backend the request went to when forwarded, otherwise null
 * @param error    failure category when not forwarded, otherwise null
 * @param detail   caller-facing failure message when not forwarded, otherwise null
 */
public record GatewayResult(OutboundResult response, Target target, GatewayError error, String detail) {

    public static GatewayResult forwarded(OutboundResult response, Target target) {
        return new GatewayResult(Objects.requireNonNull(response, "response"), target, null, null);
    }

    public static GatewayResult failed(GatewayError error, String detail) {
        return new GatewayResult(null, null, Objects.requireNonNull(error, "error"), detail);
    }

    public boolean isForwarded() {
        return response != null;
    }

    /** HTTP status the caller receives. */
    public int statusCode() {
        return isForwarded() ? response.statusCode() : error.status();
    }
}
