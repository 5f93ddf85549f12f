package com.keystone.observability;

/**
 * Immutable per-request context used for log correlation and audit enrichment.
 *
 * <p>Established by the HTTP layer at the start of every request and enriched once the caller has
 * been authenticated. The values are mirrored into SLF4J MDC by {@link RequestContextHolder}, so
 * every log line written while the request runs carries them.
 *
 * @param correlationId  ID for the business flow (propagated from {@code X-Correlation-ID})
 * @param requestId      unique ID for this request
 * @param organizationId effective organization of the caller (nullable until resolved)
 * @param userId         identity-provider subject of the caller (nullable until authenticated)
 * @param clientIp       remote address of the caller (nullable)
 * @param userAgent      {@code User-Agent} header value (nullable)
 */
public record RequestContext(
        String correlationId,
        String requestId,
        String organizationId,
        String userId,
        String clientIp,
        String userAgent) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_ORGANIZATION_ID = "organizationId";
    public static final String MDC_USER_ID = "userId";

    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy carrying the authenticated caller and their effective organization. */
    public RequestContext withCaller(String userId, String organizationId) {
        return new RequestContext(correlationId, requestId, organizationId, userId, clientIp, userAgent);
    }
}
