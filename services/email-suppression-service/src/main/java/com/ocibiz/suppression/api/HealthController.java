package com.ocibiz.suppression.api;

import com.ocibiz.suppression.config.OciProperties;
import com.ocibiz.suppression.config.ServiceProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight liveness endpoints for load balancers. Actuator's {@code /actuator/health} remains
 * available for richer checks.
 */
@RestController
public class HealthController {

    static final Map<String, Object> ENDPOINTS =
            Map.of(
                    "health", "/health",
                    "metrics", "/actuator/prometheus",
                    "email_suppression",
                    Map.of(
                            "check", "GET /api/v1/email-suppression/{email}",
                            "remove", "DELETE /api/v1/email-suppression/{email}"));

    private final ServiceProperties service;
    private final OciProperties oci;

    public HealthController(ServiceProperties service, OciProperties oci) {
        this.service = service;
        this.oci = oci;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", service.name());
        body.put("version", service.version());
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", service.name());
        body.put("version", service.version());
        body.put("region", oci.region());
        body.put("endpoints", ENDPOINTS);
        return body;
    }
}
