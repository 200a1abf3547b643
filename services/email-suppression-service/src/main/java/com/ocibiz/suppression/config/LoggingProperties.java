package com.ocibiz.suppression.config;

import com.ocibiz.observability.LoggingSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw logging settings as configured, bound from {@code ocibiz.logging.*} ({@code LOG_LEVEL},
 * {@code LOG_FORMAT}).
 *
 * <p>Values are kept as strings so that an invalid value falls back instead of failing startup;
 * {@link #toSettings()} performs the lenient parse.
 *
 * @param level minimum level name (DEBUG, INFO, WARNING, ERROR)
 * @param format {@code json} or {@code text}
 */
@ConfigurationProperties(prefix = LoggingProperties.PREFIX)
public record LoggingProperties(String level, String format) {

    public static final String PREFIX = "ocibiz.logging";

    public LoggingProperties {
        if (level == null || level.isBlank()) {
            level = "INFO";
        }
        if (format == null || format.isBlank()) {
            format = "json";
        }
    }

    public static LoggingProperties defaults() {
        return new LoggingProperties(null, null);
    }

    public LoggingSettings toSettings() {
        return LoggingSettings.parse(level, format);
    }
}
