package com.aegis.observability;

/**
 * Identifiers attached to every log line of a request.
 * <p>
 * Deliberately carries no tenant: the tenant is resolved per operation and passed explicitly,
 * never read from ambient state.
 *
 * @param correlationId id of the business flow, propagated from the {@code X-Correlation-ID}
 *                      header when the caller sends one
 * @param requestId     id of this single request
 * @param userId        acting principal, {@code null} until authenticated
 */
public record CorrelationContext(String correlationId, String requestId, String userId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A copy carrying the authenticated user. */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, requestId, userId);
    }
}
