package com.ocibiz.suppression.domain;

import java.time.Instant;

/** Outcome of a successful removal, carrying what the entry looked like before deletion. */
public record SuppressionRemoval(
        String email, String suppressionId, String previousReason, Instant previousTimeCreated) {

    static SuppressionRemoval of(String email, SuppressionEntry removed) {
        return new SuppressionRemoval(email, removed.id(), removed.reason(), removed.timeCreated());
    }
}
