package com.ocibiz.suppression.domain;

import java.util.List;

/**
 * Port to the system that owns the suppression list.
 *
 * <p>Implementations report provider failures as {@link SuppressionProviderException}.
 */
public interface SuppressionGateway {

    /**
     * Lists the suppressions recorded for an address.
     *
     * @return matching entries, possibly empty, never null
     */
    List<SuppressionEntry> findByEmail(String email);

    /** Deletes a suppression by its provider identifier. */
    void delete(String suppressionId);
}
