package com.ocibiz.observability;

import java.util.Locale;
import java.util.Optional;

/**
 * Output format of the logging sink.
 */
public enum LogFormat {

    /** One JSON object per line, for log shipping and machine parsing. */
    JSON,

    /** {@code timestamp - logger - level - message}, for local development. */
    TEXT;

    /**
     * Resolves a format name, case-insensitively.
     *
     * @param name the format name (may be null)
     * @return the format, or empty if the name is not recognized
     */
    public static Optional<LogFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> Optional.of(JSON);
            case "text" -> Optional.of(TEXT);
            default -> Optional.empty();
        };
    }
}
