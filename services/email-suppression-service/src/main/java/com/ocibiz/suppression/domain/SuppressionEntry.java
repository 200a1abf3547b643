package com.ocibiz.suppression.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry on the suppression list.
 *
 * @param id provider identifier of the suppression
 * @param emailAddress the suppressed address
 * @param reason why the address was suppressed (e.g. HARDBOUNCE, COMPLAINT); may be null
 * @param timeCreated when the address was suppressed; may be null
 */
public record SuppressionEntry(String id, String emailAddress, String reason, Instant timeCreated) {

    public SuppressionEntry {
        Objects.requireNonNull(id, "id must not be null");
    }
}
