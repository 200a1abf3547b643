package com.ocibiz.suppression.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ocibiz.suppression.domain.SuppressionRemoval;

/** Body of a successful {@code DELETE /api/v1/email-suppression/{email}}. */
public record RemoveSuppressionResponse(
        String message,
        String email,
        boolean removed,
        @JsonProperty("suppression_id") String suppressionId,
        @JsonProperty("previous_reason") String previousReason,
        @JsonProperty("previous_time_created") String previousTimeCreated) {

    static RemoveSuppressionResponse from(SuppressionRemoval removal) {
        return new RemoveSuppressionResponse(
                "Email '" + removal.email() + "' has been successfully removed from the suppression list",
                removal.email(),
                true,
                removal.suppressionId(),
                removal.previousReason(),
                removal.previousTimeCreated() == null
                        ? null
                        : removal.previousTimeCreated().toString());
    }
}
