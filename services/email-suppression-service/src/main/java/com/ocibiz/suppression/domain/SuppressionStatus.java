package com.ocibiz.suppression.domain;

import java.util.Optional;

/** Result of a suppression check. {@code suppression} is null when the address is not listed. */
public record SuppressionStatus(String email, SuppressionEntry suppression) {

    public static SuppressionStatus notSuppressed(String email) {
        return new SuppressionStatus(email, null);
    }

    public boolean suppressed() {
        return suppression != null;
    }

    public Optional<SuppressionEntry> entry() {
        return Optional.ofNullable(suppression);
    }
}
