package com.ocibiz.suppression.domain;

import com.ocibiz.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks and removes addresses on the suppression list.
 *
 * <p>When the provider returns several entries for one address the first one is used. Provider
 * failures are re-thrown as {@link SuppressionProviderException} with a message naming the
 * address; logging of failures is left to the web layer.
 *
 * <p>Every call increments {@value #OPERATIONS_METRIC}, tagged with the operation ({@code check},
 * {@code remove}) and its outcome.
 */
public class EmailSuppressionService {

    private static final StructuredLogger log =
            StructuredLogger.getLogger(EmailSuppressionService.class);

    public static final String OPERATIONS_METRIC = "suppression.operations";

    private final SuppressionGateway gateway;
    private final MeterRegistry meterRegistry;

    public EmailSuppressionService(SuppressionGateway gateway, MeterRegistry meterRegistry) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    public SuppressionStatus check(String email) {
        SuppressionStatus status;
        try {
            status = lookup(email);
        } catch (SuppressionProviderException e) {
            count("check", "error");
            throw e;
        }
        count("check", status.suppressed() ? "suppressed" : "not_suppressed");
        return status;
    }

    /**
     * Removes the suppression for an address.
     *
     * @throws SuppressionNotFoundException if the address is not suppressed
     */
    public SuppressionRemoval remove(String email) {
        SuppressionStatus status;
        try {
            status = lookup(email);
        } catch (SuppressionProviderException e) {
            count("remove", "error");
            throw e;
        }
        StructuredLogger scoped = log.withContext(Map.of("email", email));
        if (status.entry().isEmpty()) {
            scoped.warning("Removal requested for unsuppressed email");
            count("remove", "not_found");
            throw new SuppressionNotFoundException(email);
        }
        SuppressionEntry entry = status.suppression();

        try {
            gateway.delete(entry.id());
        } catch (SuppressionProviderException e) {
            count("remove", "error");
            throw e.withOperation("Failed to remove suppression for " + email);
        }
        scoped.info("Suppression removed", Map.of("suppression_id", entry.id()));
        count("remove", "removed");
        return SuppressionRemoval.of(email, entry);
    }

    private SuppressionStatus lookup(String email) {
        Objects.requireNonNull(email, "email must not be null");
        StructuredLogger scoped = log.withContext(Map.of("email", email));
        scoped.info("Checking suppression status");

        List<SuppressionEntry> entries;
        try {
            entries = gateway.findByEmail(email);
        } catch (SuppressionProviderException e) {
            throw e.withOperation("Failed to check suppression for " + email);
        }

        if (entries.isEmpty()) {
            scoped.info("Email is not suppressed");
            return SuppressionStatus.notSuppressed(email);
        }
        SuppressionEntry entry = entries.get(0);
        scoped.info(
                "Email is suppressed",
                Map.of("suppression_id", entry.id(), "reason", String.valueOf(entry.reason())));
        return new SuppressionStatus(email, entry);
    }

    private void count(String operation, String outcome) {
        Counter.builder(OPERATIONS_METRIC)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
