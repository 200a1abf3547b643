package com.ocibiz.observability;

import ch.qos.logback.classic.Level;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity levels emitted by the structured logging pipeline, ordered DEBUG &lt; INFO &lt;
 * WARNING &lt; ERROR.
 * <p>
 * Each constant maps onto the SLF4J and Logback level it is logged and filtered at, and carries
 * the label written into log records.
 */
public enum LogLevel {

    DEBUG(org.slf4j.event.Level.DEBUG, Level.DEBUG),
    INFO(org.slf4j.event.Level.INFO, Level.INFO),
    WARNING(org.slf4j.event.Level.WARN, Level.WARN),
    ERROR(org.slf4j.event.Level.ERROR, Level.ERROR);

    private final org.slf4j.event.Level slf4jLevel;
    private final Level logbackLevel;

    LogLevel(org.slf4j.event.Level slf4jLevel, Level logbackLevel) {
        this.slf4jLevel = slf4jLevel;
        this.logbackLevel = logbackLevel;
    }

    /** The SLF4J level events of this severity are logged at. */
    public org.slf4j.event.Level slf4jLevel() {
        return slf4jLevel;
    }

    /** The Logback level used for logger and appender thresholds. */
    public Level logbackLevel() {
        return logbackLevel;
    }

    /** The label written into the {@code level} field of a record. */
    public String label() {
        return name();
    }

    /**
     * Resolves a level name, case-insensitively. {@code WARN} is accepted for {@link #WARNING};
     * {@code CRITICAL} and {@code FATAL} are accepted for {@link #ERROR}.
     *
     * @param name the level name (may be null)
     * @return the level, or empty if the name is not recognized
     */
    public static Optional<LogLevel> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG" -> Optional.of(DEBUG);
            case "INFO" -> Optional.of(INFO);
            case "WARN", "WARNING" -> Optional.of(WARNING);
            case "ERROR", "CRITICAL", "FATAL" -> Optional.of(ERROR);
            default -> Optional.empty();
        };
    }

    /**
     * Maps a Logback level onto the record severity. TRACE reports as {@link #DEBUG}.
     */
    public static LogLevel fromLogback(Level level) {
        if (level == null) {
            return INFO;
        }
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ERROR;
            case Level.WARN_INT -> WARNING;
            case Level.INFO_INT -> INFO;
            default -> DEBUG;
        };
    }
}
