package com.ocibiz.observability;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks the values of log fields whose names look like credentials.
 * <p>
 * A field is sensitive when its name contains one of the patterns, case-insensitively, so
 * {@code accessToken} and {@code X-Api-Key} match {@code token} and {@code api-key}.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "passphrase", "token", "secret", "authorization",
            "apikey", "api_key", "api-key", "credential", "private_key", "privatekey"
    );

    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns field name fragments to treat as sensitive; an empty set disables redaction
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        this.compiledPattern = patterns.isEmpty()
                ? null
                : Pattern.compile(String.join("|", patterns.stream()
                        .map(Pattern::quote)
                        .toList()), Pattern.CASE_INSENSITIVE);
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null || compiledPattern == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }
}
