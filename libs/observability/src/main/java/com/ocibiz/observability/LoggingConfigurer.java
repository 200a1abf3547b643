package com.ocibiz.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide logging sink setup on top of Logback.
 * <p>
 * {@link #configure(LoggingSettings)} installs exactly one appender on the root logger, writing
 * one record per event to standard output through the layout selected by
 * {@link LoggingSettings#format()}. Events below {@link LoggingSettings#level()} are dropped both
 * by the root logger level and by a threshold filter on the appender, so explicitly configured
 * loggers cannot leak lower-severity events.
 * <p>
 * Configuration replaces rather than accumulates: every call detaches and stops all root
 * appenders before installing the new one, so calling it twice never duplicates lines. The
 * destination stream itself is never closed by a reconfiguration.
 * <p>
 * Logback's {@link OutputStreamAppender} writes each encoded record under its own lock, which
 * keeps concurrent writers from interleaving partial lines. I/O failures are reported to the
 * Logback status manager and never propagate to the logging caller.
 */
public final class LoggingConfigurer {

    /** Name of the appender installed on the root logger. */
    public static final String APPENDER_NAME = "STRUCTURED_OUT";

    /**
     * Minimum levels for known-noisy container and framework channels. Access-type channels sit
     * above the general error channels.
     */
    static final Map<String, Level> NOISY_LOGGERS = Map.of(
            "org.apache.catalina.core", Level.INFO,
            "org.apache.coyote", Level.INFO,
            "org.apache.catalina.valves", Level.WARN,
            "org.springframework.web.servlet.DispatcherServlet", Level.WARN);

    private static volatile LoggingSettings current;

    private LoggingConfigurer() {
        // utility class
    }

    /**
     * Configures the sink to write to {@code System.out}.
     */
    public static void configure(LoggingSettings settings) {
        configure(settings, System.out);
    }

    /**
     * Configures the sink to write to the given stream.
     *
     * @param settings minimum level and format
     * @param target   destination stream (not closed by this class)
     */
    public static void configure(LoggingSettings settings, OutputStream target) {
        configure(settings, target, Clock.systemUTC());
    }

    /**
     * Configures the sink with an explicit clock for record timestamps.
     */
    public static synchronized void configure(LoggingSettings settings, OutputStream target, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        LoggerContext context = loggerContext();

        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(settings.level().logbackLevel());

        root.addAppender(createAppender(context, settings, target, clock));

        NOISY_LOGGERS.forEach((name, level) -> context.getLogger(name).setLevel(level));
        current = settings;
    }

    /**
     * Returns the settings installed by the most recent {@link #configure} call, if any.
     */
    public static Optional<LoggingSettings> currentSettings() {
        return Optional.ofNullable(current);
    }

    private static OutputStreamAppender<ILoggingEvent> createAppender(
            LoggerContext context, LoggingSettings settings, OutputStream target, Clock clock) {
        StructuredLayoutBase layout = settings.format() == LogFormat.JSON
                ? new JsonLogLayout(clock, new SensitiveDataRedactor())
                : new TextLogLayout(clock);
        layout.setContext(context);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.setLayout(layout);
        encoder.start();

        ThresholdFilter threshold = new ThresholdFilter();
        threshold.setContext(context);
        threshold.setLevel(settings.level().logbackLevel().toString());
        threshold.start();

        OutputStreamAppender<ILoggingEvent> appender = new OutputStreamAppender<>();
        appender.setName(APPENDER_NAME);
        appender.setContext(context);
        appender.setEncoder(encoder);
        appender.addFilter(threshold);
        appender.setOutputStream(new NonClosingOutputStream(target));
        appender.start();
        return appender;
    }

    private static LoggerContext loggerContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            throw new IllegalStateException(
                    "Logback is not the active SLF4J backend: " + factory.getClass().getName());
        }
        return context;
    }
}
