package com.ocibiz.suppression.infrastructure.oci;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ocibiz.suppression.domain.SuppressionEntry;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for {@link OciSuppressionGateway} against a mocked OCI Email client. */
@DisplayName("OciSuppressionGateway")
class OciSuppressionGatewayTest {

    private static final String TENANCY = "ocid1.tenancy.oc1..example";
    private static final Instant CREATED = Instant.parse("2024-01-15T10:30:00Z");

    private final Email client = mock(Email.class);
    private final OciSuppressionGateway gateway = new OciSuppressionGateway(client, TENANCY);

    private static SuppressionSummary summary(String id, String email) {
        SuppressionSummary summary = mock(SuppressionSummary.class);
        when(summary.getId()).thenReturn(id);
        when(summary.getEmailAddress()).thenReturn(email);
        when(summary.getTimeCreated()).thenReturn(Date.from(CREATED));
        return summary;
    }

    private void listReturns(List<SuppressionSummary> items) {
        ListSuppressionsResponse response = mock(ListSuppressionsResponse.class);
        when(response.getItems()).thenReturn(items);
        when(client.listSuppressions(any(ListSuppressionsRequest.class))).thenReturn(response);
    }

    @Test
    @DisplayName("lists suppressions in the tenancy filtered by email address")
    void queriesByTenancyAndEmail() {
        listReturns(List.of());

        gateway.findByEmail("user@example.com");

        var captor = ArgumentCaptor.forClass(ListSuppressionsRequest.class);
        verify(client).listSuppressions(captor.capture());
        assertThat(captor.getValue().getCompartmentId()).isEqualTo(TENANCY);
        assertThat(captor.getValue().getEmailAddress()).isEqualTo("user@example.com");
    }

    @Test
    @DisplayName("maps summaries to entries")
    void mapsSummaries() {
        listReturns(List.of(summary("ocid1.emailsuppression.oc1..aaa", "user@example.com")));

        List<SuppressionEntry> entries = gateway.findByEmail("user@example.com");

        assertThat(entries)
                .containsExactly(
                        new SuppressionEntry(
                                "ocid1.emailsuppression.oc1..aaa", "user@example.com", null, CREATED));
    }

    @Test
    @DisplayName("treats missing items as no suppressions")
    void nullItemsAreEmpty() {
        listReturns(null);

        assertThat(gateway.findByEmail("user@example.com")).isEmpty();
    }

    @Test
    @DisplayName("deletes by suppression id")
    void deletesById() {
        gateway.delete("ocid1.emailsuppression.oc1..aaa");

        var captor = ArgumentCaptor.forClass(DeleteSuppressionRequest.class);
        verify(client).deleteSuppression(captor.capture());
        assertThat(captor.getValue().getSuppressionId())
                .isEqualTo("ocid1.emailsuppression.oc1..aaa");
    }

    @Test
    @DisplayName("translates BmcException, keeping status and service code")
    void translatesBmcException() {
        var failure = new BmcException(503, "ServiceUnavailable", "Service unavailable", "opc-1");
        when(client.listSuppressions(any(ListSuppressionsRequest.class))).thenThrow(failure);

        assertThatThrownBy(() -> gateway.findByEmail("user@example.com"))
                .isInstanceOf(SuppressionProviderException.class)
                .hasCause(failure)
                .hasMessageContaining("Service unavailable")
                .satisfies(
                        e -> {
                            var provider = (SuppressionProviderException) e;
                            assertThat(provider.statusCode()).isEqualTo(503);
                            assertThat(provider.serviceCode()).isEqualTo("ServiceUnavailable");
                        });
    }

    @Test
    @DisplayName("translates delete failures")
    void translatesDeleteFailure() {
        var failure = new BmcException(404, "NotAuthorizedOrNotFound", "Not found", "opc-2");
        when(client.deleteSuppression(any(DeleteSuppressionRequest.class))).thenThrow(failure);

        assertThatThrownBy(() -> gateway.delete("ocid1.emailsuppression.oc1..aaa"))
                .isInstanceOf(SuppressionProviderException.class)
                .hasCause(failure);
    }
}
