package com.bastion.gateway.domain.policy;

/**
 * Why a matched rule refused the request.
 */
public enum DenyReason {

    INSUFFICIENT_GROUP("principal is not a member of a required group"),

    UNTRUSTED_DEVICE("request does not come from a trusted device");

    private final String description;

    DenyReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
