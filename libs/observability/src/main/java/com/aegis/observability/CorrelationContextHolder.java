package com.aegis.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys so that every log statement on this thread includes
 * them; clearing removes them. Servlet filters set the context on entry and clear it in a
 * {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        setMdc(CorrelationContext.MDC_USER_ID, context.userId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Adds the authenticated user to the current context, if one is set. */
    public static void bindUser(String userId) {
        get().ifPresent(ctx -> set(ctx.withUserId(userId)));
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
