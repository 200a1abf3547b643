package com.ocibiz.observability;

/**
 * Immutable process-wide logging configuration: the minimum severity to emit and the output
 * format.
 *
 * <p>A null component is treated like an unrecognized value: {@link #DEFAULT_LEVEL} and
 * {@link #FALLBACK_FORMAT} (TEXT). This differs from the JSON default applied when the format is
 * simply not configured; that default lives with the configuration source
 * ({@code ocibiz.logging.format} defaults to {@code json}), not here.
 *
 * @param level  minimum severity; events below it are dropped
 * @param format output format of every record
 */
public record LoggingSettings(LogLevel level, LogFormat format) {

    /** Level used when none, or an unrecognized one, is configured. */
    public static final LogLevel DEFAULT_LEVEL = LogLevel.INFO;

    /** Format used when an unrecognized one is configured. */
    public static final LogFormat FALLBACK_FORMAT = LogFormat.TEXT;

    public LoggingSettings {
        if (level == null) {
            level = DEFAULT_LEVEL;
        }
        if (format == null) {
            format = FALLBACK_FORMAT;
        }
    }

    /**
     * Parses raw, typically environment-derived, values. Invalid values never fail: an unknown
     * level falls back to {@link #DEFAULT_LEVEL}, any format other than {@code json}/{@code text}
     * falls back to {@link #FALLBACK_FORMAT}.
     */
    public static LoggingSettings parse(String level, String format) {
        return new LoggingSettings(
                LogLevel.fromName(level).orElse(DEFAULT_LEVEL),
                LogFormat.fromName(format).orElse(FALLBACK_FORMAT));
    }
}
