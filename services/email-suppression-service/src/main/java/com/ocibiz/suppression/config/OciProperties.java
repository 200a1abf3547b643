package com.ocibiz.suppression.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * OCI Email Delivery access settings, bound from {@code ocibiz.oci.*}.
 *
 * <pre>
 * ocibiz:
 *   oci:
 *     enabled: true
 *     region: ap-mumbai-1
 *     tenancy-ocid: ocid1.tenancy.oc1..example
 *     auth: instance-principal   # or config-file
 *     config-profile: DEFAULT
 * </pre>
 *
 * <p>Suppressions live in the tenancy (root compartment), so the tenancy OCID doubles as the
 * compartment id of every suppression call.
 *
 * @param enabled whether the OCI-backed gateway is created (default true)
 * @param region OCI region identifier
 * @param tenancyOcid tenancy OCID; required when enabled
 * @param auth how the client authenticates
 * @param configProfile profile read from {@code ~/.oci/config} in {@link AuthMode#CONFIG_FILE} mode
 */
@ConfigurationProperties(prefix = "ocibiz.oci")
@Validated
public record OciProperties(
        Boolean enabled,
        @NotBlank String region,
        String tenancyOcid,
        AuthMode auth,
        String configProfile) {

    /** Authentication strategy for the OCI SDK client. */
    public enum AuthMode {
        /** Instance principals of the compute instance the service runs on. */
        INSTANCE_PRINCIPAL,
        /** API key from the local OCI config file, for development. */
        CONFIG_FILE
    }

    public OciProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (region == null || region.isBlank()) {
            region = "ap-mumbai-1";
        }
        if (auth == null) {
            auth = AuthMode.INSTANCE_PRINCIPAL;
        }
        if (configProfile == null || configProfile.isBlank()) {
            configProfile = "DEFAULT";
        }
        if (enabled && (tenancyOcid == null || tenancyOcid.isBlank())) {
            throw new IllegalArgumentException(
                    "ocibiz.oci.tenancy-ocid must be set when OCI access is enabled");
        }
    }
}
