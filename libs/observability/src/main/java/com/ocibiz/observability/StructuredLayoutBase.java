package com.ocibiz.observability;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;

import java.time.Clock;
import java.time.Instant;

/**
 * Common base for the record layouts: stamps each event with the wall-clock time at format time
 * and guarantees that formatting never throws.
 * <p>
 * A failure inside {@link #format(ILoggingEvent, Instant)} is reported to the Logback status
 * manager and the event is written as a minimal record produced by
 * {@link #fallback(ILoggingEvent, Instant)}, so a logging defect never escapes into the code
 * that logged.
 */
abstract class StructuredLayoutBase extends LayoutBase<ILoggingEvent> {

    private final Clock clock;

    protected StructuredLayoutBase(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public final String doLayout(ILoggingEvent event) {
        Instant timestamp = clock.instant();
        try {
            return format(event, timestamp) + CoreConstants.LINE_SEPARATOR;
        } catch (RuntimeException e) {
            addError("Failed to format event from logger " + event.getLoggerName(), e);
            return fallback(event, timestamp) + CoreConstants.LINE_SEPARATOR;
        }
    }

    /**
     * Serializes the event into a single record, without the line terminator.
     */
    protected abstract String format(ILoggingEvent event, Instant timestamp);

    /**
     * Serializes only the fixed fields of the event. Must not throw.
     */
    protected abstract String fallback(ILoggingEvent event, Instant timestamp);

    protected static String levelLabel(ILoggingEvent event) {
        return LogLevel.fromLogback(event.getLevel()).label();
    }

    protected static String loggerName(ILoggingEvent event) {
        return event.getLoggerName() != null ? event.getLoggerName() : "";
    }

    protected static String rawMessage(ILoggingEvent event) {
        return event.getMessage() != null ? event.getMessage() : "";
    }
}
