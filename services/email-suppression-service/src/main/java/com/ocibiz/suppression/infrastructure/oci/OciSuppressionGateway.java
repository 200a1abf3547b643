package com.ocibiz.suppression.infrastructure.oci;

import com.ocibiz.suppression.domain.SuppressionEntry;
import com.ocibiz.suppression.domain.SuppressionGateway;
import com.ocibiz.suppression.domain.SuppressionProviderException;
import com.oracle.bmc.email.Email;
import com.oracle.bmc.email.model.SuppressionSummary;
import com.oracle.bmc.email.requests.DeleteSuppressionRequest;
import com.oracle.bmc.email.requests.ListSuppressionsRequest;
import com.oracle.bmc.email.responses.ListSuppressionsResponse;
import com.oracle.bmc.model.BmcException;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SuppressionGateway} backed by the OCI Email Delivery API.
 *
 * <p>Only the first page of {@code ListSuppressions} is read; filtering by exact address keeps it
 * to at most a handful of entries. {@link BmcException}s are translated to {@link
 * SuppressionProviderException}, keeping the HTTP status and service code.
 */
public class OciSuppressionGateway implements SuppressionGateway {

    private static final Logger log = LoggerFactory.getLogger(OciSuppressionGateway.class);

    private final Email client;
    private final String compartmentId;

    public OciSuppressionGateway(Email client, String compartmentId) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.compartmentId = Objects.requireNonNull(compartmentId, "compartmentId must not be null");
    }

    @Override
    public List<SuppressionEntry> findByEmail(String email) {
        ListSuppressionsRequest request =
                ListSuppressionsRequest.builder()
                        .compartmentId(compartmentId)
                        .emailAddress(email)
                        .build();
        ListSuppressionsResponse response;
        try {
            response = client.listSuppressions(request);
        } catch (BmcException e) {
            throw translate(e);
        }
        List<SuppressionSummary> items = response.getItems();
        log.debug("ListSuppressions returned {} item(s)", items == null ? 0 : items.size());
        if (items == null) {
            return List.of();
        }
        return items.stream().map(OciSuppressionGateway::toEntry).toList();
    }

    @Override
    public void delete(String suppressionId) {
        try {
            client.deleteSuppression(
                    DeleteSuppressionRequest.builder().suppressionId(suppressionId).build());
        } catch (BmcException e) {
            throw translate(e);
        }
    }

    static SuppressionEntry toEntry(SuppressionSummary summary) {
        var reason = summary.getReason();
        return new SuppressionEntry(
                summary.getId(),
                summary.getEmailAddress(),
                reason == null ? null : reason.getValue(),
                toInstant(summary.getTimeCreated()));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static SuppressionProviderException translate(BmcException e) {
        return new SuppressionProviderException(
                e.getMessage(), e.getStatusCode(), e.getServiceCode(), e);
    }
}
