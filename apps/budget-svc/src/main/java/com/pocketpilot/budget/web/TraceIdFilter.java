package com.pocketpilot.budget.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a trace id and, for {@code /users/{userId}/...} routes, the budget owner to the request
 * so that every log line of a prescription or transaction call can be correlated.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    static final String TRACE_MDC_KEY = "trace_id";
    static final String USER_MDC_KEY = "user_id";
    private static final Pattern USER_PATH = Pattern.compile("^/users/([0-9a-fA-F-]{36})(/.*)?$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        String path = request.getRequestURI();
        UUID userId = budgetOwner(path);
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, path, userId));
        MDC.put(TRACE_MDC_KEY, traceId);
        if (userId != null) {
            MDC.put(USER_MDC_KEY, userId.toString());
        }
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_MDC_KEY);
            MDC.remove(USER_MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static UUID budgetOwner(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = USER_PATH.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return UUID.fromString(matcher.group(1));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
