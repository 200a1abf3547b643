package com.ocibiz.observability;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable layout: {@code yyyy-MM-dd HH:mm:ss - logger - LEVEL - message}, in UTC.
 * <p>
 * The correlation identifier and extra fields are not rendered in this mode. A throwable, when
 * present, follows on the next lines.
 */
public class TextLogLayout extends StructuredLayoutBase {

    static final String SEPARATOR = " - ";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public TextLogLayout() {
        this(Clock.systemUTC());
    }

    public TextLogLayout(Clock clock) {
        super(clock);
    }

    @Override
    protected String format(ILoggingEvent event, Instant timestamp) {
        String line = line(timestamp, event, event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable == null) {
            return line;
        }
        return line + CoreConstants.LINE_SEPARATOR + ThrowableProxyUtil.asString(throwable).stripTrailing();
    }

    @Override
    protected String fallback(ILoggingEvent event, Instant timestamp) {
        return line(timestamp, event, rawMessage(event));
    }

    private static String line(Instant timestamp, ILoggingEvent event, String message) {
        return TIMESTAMP_FORMAT.format(timestamp)
                + SEPARATOR + loggerName(event)
                + SEPARATOR + levelLabel(event)
                + SEPARATOR + message;
    }
}
