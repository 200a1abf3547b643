package com.ocibiz.suppression.infrastructure.web;

import com.ocibiz.observability.CorrelationContextHolder;
import com.ocibiz.observability.StructuredLogger;
import com.ocibiz.suppression.domain.SuppressionNotFoundException;
import com.ocibiz.suppression.domain.SuppressionProviderException;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://ocibiz.dev/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "Email 'user@example.com' is not in the suppression list",
 *   "timestamp": "2025-03-14T09:26:53.589Z",
 *   "request_id": "ab12cd34"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final StructuredLogger log =
            StructuredLogger.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SuppressionNotFoundException.class)
    public ProblemDetail handleNotFound(SuppressionNotFoundException ex) {
        log.warning("Suppression not found", Map.of("email", ex.email()));
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(SuppressionProviderException.class)
    public ProblemDetail handleProvider(SuppressionProviderException ex) {
        log.error(
                "OCI API error",
                Map.of(
                        "provider_status", ex.statusCode(),
                        "service_code", String.valueOf(ex.serviceCode())),
                ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "OCI API Error",
                "provider",
                "OCI API Error: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "Internal server error: " + ex.getMessage());
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://ocibiz.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get().ifPresent(id -> problem.setProperty("request_id", id));
        return problem;
    }
}
