package com.pocketpilot.budget.web;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-request context bound to the handling thread.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static String currentPath() {
        return get().map(RequestContext::path).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * @param userId owner of the budget addressed by the request, or {@code null} outside user routes
     */
    public record RequestContext(String traceId, String path, UUID userId) {
    }
}
