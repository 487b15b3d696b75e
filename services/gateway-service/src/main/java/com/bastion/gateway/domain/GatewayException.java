package com.bastion.gateway.domain;

/**
 * Thrown by gateway components for failures that already have a place in the
 * {@link GatewayError} taxonomy. The message is the caller-facing detail.
 */
public class GatewayException extends RuntimeException {

    private final GatewayError error;

    public GatewayException(GatewayError error, String message) {
        super(message);
        this.error = error;
    }

    public GatewayException(GatewayError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public GatewayError error() {
        return error;
    }
}
