package com.ocibiz.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Logging entry point that attaches an open-ended map of extra fields to each event.
 * <p>
 * Extra fields travel as SLF4J 2 key/value pairs, which {@link JsonLogLayout} merges into the
 * top level of the record next to the correlation identifier picked up from MDC. A logger created
 * with {@link #withContext(Map)} carries bound fields into every call; fields passed to a single
 * call take precedence over bound ones with the same key.
 *
 * <pre>
 * private static final StructuredLogger log = StructuredLogger.getLogger(MyService.class);
 *
 * log.info("Checking suppression", Map.of("email", email));
 * log.withContext(Map.of("email", email)).warning("Not suppressed");
 * </pre>
 */
public final class StructuredLogger {

    private final Logger delegate;
    private final Map<String, Object> boundFields;

    private StructuredLogger(Logger delegate, Map<String, Object> boundFields) {
        this.delegate = delegate;
        this.boundFields = boundFields;
    }

    public static StructuredLogger getLogger(Class<?> type) {
        return new StructuredLogger(LoggerFactory.getLogger(type), Map.of());
    }

    public static StructuredLogger getLogger(String name) {
        return new StructuredLogger(LoggerFactory.getLogger(name), Map.of());
    }

    /**
     * Returns the correlation identifier of the request being handled on this thread, if any.
     */
    public static Optional<String> currentCorrelationId() {
        return CorrelationContextHolder.get();
    }

    /**
     * Returns a logger with the same name that adds {@code fields} to every event. Fields already
     * bound to this logger are kept unless overridden.
     */
    public StructuredLogger withContext(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(boundFields);
        merged.putAll(fields);
        return new StructuredLogger(delegate, Collections.unmodifiableMap(merged));
    }

    public String name() {
        return delegate.getName();
    }

    public Map<String, Object> boundFields() {
        return boundFields;
    }

    public boolean isEnabled(LogLevel level) {
        return delegate.isEnabledForLevel(level.slf4jLevel());
    }

    /**
     * Emits one event.
     *
     * @param level   severity
     * @param message message text
     * @param extras  extra fields for this event only (nullable)
     * @param error   throwable whose stack trace is attached to the record (nullable)
     */
    public void log(LogLevel level, String message, Map<String, ?> extras, Throwable error) {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (!isEnabled(level)) {
            return;
        }
        LoggingEventBuilder event = delegate.atLevel(level.slf4jLevel());
        fieldsFor(extras).forEach(event::addKeyValue);
        if (error != null) {
            event.setCause(error);
        }
        event.log(message);
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, ?> extras) {
        log(LogLevel.DEBUG, message, extras, null);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, ?> extras) {
        log(LogLevel.INFO, message, extras, null);
    }

    public void warning(String message) {
        log(LogLevel.WARNING, message, null, null);
    }

    public void warning(String message, Map<String, ?> extras) {
        log(LogLevel.WARNING, message, extras, null);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Map<String, ?> extras) {
        log(LogLevel.ERROR, message, extras, null);
    }

    public void error(String message, Throwable error) {
        log(LogLevel.ERROR, message, null, error);
    }

    public void error(String message, Map<String, ?> extras, Throwable error) {
        log(LogLevel.ERROR, message, extras, error);
    }

    private Map<String, Object> fieldsFor(Map<String, ?> extras) {
        if (extras == null || extras.isEmpty()) {
            return boundFields;
        }
        if (boundFields.isEmpty()) {
            return new LinkedHashMap<>(extras);
        }
        Map<String, Object> merged = new LinkedHashMap<>(boundFields);
        merged.putAll(extras);
        return merged;
    }
}
