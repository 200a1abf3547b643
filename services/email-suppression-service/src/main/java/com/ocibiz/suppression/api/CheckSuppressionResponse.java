package com.ocibiz.suppression.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ocibiz.suppression.domain.SuppressionStatus;

/** Body of {@code GET /api/v1/email-suppression/{email}}. */
public record CheckSuppressionResponse(
        String email,
        @JsonProperty("is_suppressed") boolean suppressed,
        SuppressionDetail suppression) {

    static CheckSuppressionResponse from(SuppressionStatus status) {
        return new CheckSuppressionResponse(
                status.email(),
                status.suppressed(),
                status.entry().map(SuppressionDetail::from).orElse(null));
    }
}
