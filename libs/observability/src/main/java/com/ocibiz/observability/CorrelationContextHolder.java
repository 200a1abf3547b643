package com.ocibiz.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for the current request's correlation identifier, bridged into SLF4J MDC.
 * <p>
 * While an identifier is installed, the MDC key {@value #MDC_REQUEST_ID} carries the same value,
 * so every logging event created on this thread picks it up without the identifier being passed
 * through method signatures. Clearing removes both the thread-local value and the MDC key.
 * <p>
 * Each servlet request is served by a single thread, which keeps concurrent requests isolated.
 * When work is handed to a thread pool, callers must transfer the identifier explicitly with
 * {@link #runWithContext(String, Runnable)}.
 */
public final class CorrelationContextHolder {

    /**
     * MDC key (and JSON field name) for the request correlation identifier.
     */
    public static final String MDC_REQUEST_ID = "request_id";

    private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Installs the correlation identifier for the current thread and mirrors it into MDC.
     *
     * @param requestId the identifier to install (must not be null or blank)
     * @throws IllegalArgumentException if requestId is null or blank
     */
    public static void set(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        REQUEST_ID.set(requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
    }

    /**
     * Returns the current thread's correlation identifier, if one is installed.
     */
    public static Optional<String> get() {
        return Optional.ofNullable(REQUEST_ID.get());
    }

    /**
     * Removes the correlation identifier and its MDC key for the current thread.
     */
    public static void clear() {
        REQUEST_ID.remove();
        MDC.remove(MDC_REQUEST_ID);
    }

    /**
     * Executes a {@link Runnable} with the given identifier installed, then restores the previous
     * identifier (or clears if there was none), even when the runnable throws.
     *
     * @param requestId the identifier for the duration of the runnable
     * @param runnable  the work to execute
     */
    public static void runWithContext(String requestId, Runnable runnable) {
        String previous = REQUEST_ID.get();
        try {
            set(requestId);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Wraps a {@link Runnable} so that it runs with the identifier current at wrap time.
     * Returns the runnable unchanged when no identifier is installed.
     */
    public static Runnable wrap(Runnable runnable) {
        String captured = REQUEST_ID.get();
        if (captured == null) {
            return runnable;
        }
        return () -> runWithContext(captured, runnable);
    }
}
