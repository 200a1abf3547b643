package com.ocibiz.observability;

import java.util.UUID;

/**
 * Generates short correlation identifiers for inbound requests.
 */
public final class CorrelationIds {

    /** Length of a generated identifier, in hex characters. */
    public static final int REQUEST_ID_LENGTH = 8;

    private CorrelationIds() {
        // utility class
    }

    /**
     * Returns a new identifier of {@value #REQUEST_ID_LENGTH} lowercase hex characters taken from
     * a random UUID.
     */
    public static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, REQUEST_ID_LENGTH);
    }
}
