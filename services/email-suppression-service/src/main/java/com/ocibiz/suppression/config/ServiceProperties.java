package com.ocibiz.suppression.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity reported by the health endpoints.
 *
 * <p>Bound from the {@code ocibiz.service.*} prefix; {@code application.yml} maps the {@code
 * API_TITLE}, {@code API_VERSION} and {@code API_DESCRIPTION} environment variables onto it.
 *
 * @param name Human-readable service name. Required.
 * @param version Service version string.
 * @param description Short description of the service.
 */
@ConfigurationProperties(prefix = "ocibiz.service")
@Validated
public record ServiceProperties(@NotBlank String name, String version, String description) {

    public ServiceProperties {
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
        if (description == null) {
            description = "";
        }
    }
}
