package com.ocibiz.suppression.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ocibiz.suppression.domain.SuppressionEntry;

/** Suppression entry as returned by the check endpoint. */
public record SuppressionDetail(
        String id, String reason, @JsonProperty("time_created") String timeCreated) {

    static SuppressionDetail from(SuppressionEntry entry) {
        return new SuppressionDetail(
                entry.id(),
                entry.reason(),
                entry.timeCreated() == null ? null : entry.timeCreated().toString());
    }
}
