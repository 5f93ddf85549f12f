package com.keystone.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link RequestContext} with an SLF4J MDC bridge.
 *
 * <p>Servlet containers reuse threads, so whoever calls {@link #set(RequestContext)} must call
 * {@link #clear()} in a {@code finally} block.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // utility class
    }

    /**
     * Sets the request context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(RequestContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(RequestContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(RequestContext.MDC_ORGANIZATION_ID, context.organizationId());
        putOrRemove(RequestContext.MDC_USER_ID, context.userId());
    }

    /** Returns the current thread's request context, if any. */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the authenticated caller on the current context. No-op when no context is set
     * (e.g. when security components run outside an HTTP request).
     */
    public static void attachCaller(String userId, String organizationId) {
        get().ifPresent(ctx -> set(ctx.withCaller(userId, organizationId)));
    }

    /** Clears the context and all MDC keys owned by this holder. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_REQUEST_ID);
        MDC.remove(RequestContext.MDC_ORGANIZATION_ID);
        MDC.remove(RequestContext.MDC_USER_ID);
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
