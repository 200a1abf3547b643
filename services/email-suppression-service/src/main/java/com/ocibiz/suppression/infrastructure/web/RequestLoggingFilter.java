package com.ocibiz.suppression.infrastructure.web;

import com.ocibiz.observability.CorrelationContextHolder;
import com.ocibiz.observability.CorrelationIds;
import com.ocibiz.observability.StructuredLogger;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that assigns a request ID to every HTTP request and logs its lifecycle.
 *
 * <p>For each request the filter:
 *
 * <ol>
 *   <li>generates a fresh 8-character ID and binds it to {@link CorrelationContextHolder}, so every
 *       log line emitted while handling the request carries it as {@code request_id}
 *   <li>echoes the ID in the {@code X-Request-ID} response header
 *   <li>logs {@code Request received} and then either {@code Request completed} with method, path,
 *       status and duration, or {@code Request failed} with the error before re-throwing it
 *   <li>clears the context exactly once, whatever happened
 * </ol>
 *
 * <p>Client-supplied request IDs are ignored. Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the ID
 * is bound before any other filter logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final StructuredLogger log = StructuredLogger.getLogger(RequestLoggingFilter.class);

    private final Supplier<String> requestIds;

    public RequestLoggingFilter() {
        this(CorrelationIds::newRequestId);
    }

    RequestLoggingFilter(Supplier<String> requestIds) {
        this.requestIds = requestIds;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            String requestId = requestIds.get();
            CorrelationContextHolder.set(requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);

            Map<String, Object> received = requestFields(request);
            received.put("client_host", clientHost(request));
            log.info("Request received", received);
            try {
                filterChain.doFilter(request, response);
            } catch (IOException | ServletException | RuntimeException | Error e) {
                logFailure(request, start, e);
                throw e;
            }
            Map<String, Object> completed = requestFields(request);
            completed.put("status_code", response.getStatus());
            completed.put("duration_ms", elapsedMillis(start));
            log.info("Request completed", completed);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private static void logFailure(HttpServletRequest request, long start, Throwable failure) {
        Map<String, Object> extras = requestFields(request);
        extras.put("duration_ms", elapsedMillis(start));
        extras.put("error", String.valueOf(failure.getMessage()));
        log.error("Request failed: " + failure.getMessage(), extras, failure);
    }

    private static Map<String, Object> requestFields(HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("method", request.getMethod());
        fields.put("path", request.getRequestURI());
        return fields;
    }

    private static String clientHost(HttpServletRequest request) {
        String host = request.getRemoteAddr();
        return host != null ? host : "unknown";
    }

    private static long elapsedMillis(long start) {
        return Math.max(0L, (System.nanoTime() - start) / 1_000_000L);
    }
}
