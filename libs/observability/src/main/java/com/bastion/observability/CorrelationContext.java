package com.bastion.observability;

/**
 * Immutable correlation context that flows through a single gateway request.
 * <p>
 * Every inbound request establishes a {@code CorrelationContext} before it is authenticated.
 * The identifiers are echoed to the caller, forwarded to the backend as a header and injected
 * into SLF4J MDC so every log line written while the request is in flight carries them.
 *
 * @param correlationId unique ID for the request flow, propagated from {@code X-Correlation-ID} or generated
 * @param userId        authenticated principal name (null until the credential has been validated)
 * @param requestId     unique ID for this hop (one correlation may span several hops)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /**
     * HTTP header carrying the correlation ID, inbound from callers and outbound to backends.
     */
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for the authenticated principal.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given principal name.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, requestId);
    }
}
