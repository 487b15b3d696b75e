package com.bastion.gateway.domain.policy;

/**
 * Logical backend a request can be routed to.
 */
public enum Target {

    /** Internal backend reachable only through the gateway. Short timeout. */
    PROTECTED,

    /** Default or external backend for paths no specific rule covers. Longer timeout. */
    DEFAULT
}
