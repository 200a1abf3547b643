package com.ocibiz.suppression;

import com.ocibiz.suppression.config.LoggingProperties;
import com.ocibiz.suppression.config.OciProperties;
import com.ocibiz.suppression.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Email suppression service: checks and removes addresses on the OCI Email Delivery suppression
 * list.
 *
 * <p>Besides the suppression API, the application wires:
 *
 * <ul>
 *   <li>Structured JSON/text logging configured from {@code ocibiz.logging.*} before the context
 *       starts ({@link com.ocibiz.suppression.config.LoggingInitializer})
 *   <li>A request interceptor that tags every log line with a per-request identifier
 *   <li>RFC 7807 error responses
 *   <li>Actuator health and Prometheus endpoints
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    ServiceProperties.class,
    OciProperties.class,
    LoggingProperties.class
})
public class EmailSuppressionApplication {

    private static final Logger log = LoggerFactory.getLogger(EmailSuppressionApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EmailSuppressionApplication.class, args);
        log.info("Email suppression service started successfully");
    }
}
