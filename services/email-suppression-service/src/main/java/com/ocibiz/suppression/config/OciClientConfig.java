package com.ocibiz.suppression.config;

import com.ocibiz.suppression.domain.SuppressionGateway;
import com.ocibiz.suppression.infrastructure.oci.OciSuppressionGateway;
import com.oracle.bmc.auth.AbstractAuthenticationDetailsProvider;
import com.oracle.bmc.auth.ConfigFileAuthenticationDetailsProvider;
import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.email.EmailClient;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the OCI Email Delivery client and the gateway backed by it.
 *
 * <p>Disabled with {@code ocibiz.oci.enabled=false}; another {@link SuppressionGateway} bean must
 * then be provided (tests use a mock).
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(
        prefix = "ocibiz.oci",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class OciClientConfig {

    private static final Logger log = LoggerFactory.getLogger(OciClientConfig.class);

    @Bean(destroyMethod = "close")
    public EmailClient emailClient(OciProperties properties) throws IOException {
        EmailClient client = EmailClient.builder().build(authenticationProvider(properties));
        client.setRegion(properties.region());
        log.info(
                "OCI Email client created for region {} using {} authentication",
                properties.region(),
                properties.auth());
        return client;
    }

    @Bean
    public SuppressionGateway suppressionGateway(EmailClient emailClient, OciProperties properties) {
        return new OciSuppressionGateway(emailClient, properties.tenancyOcid());
    }

    static AbstractAuthenticationDetailsProvider authenticationProvider(OciProperties properties)
            throws IOException {
        return switch (properties.auth()) {
            case CONFIG_FILE -> new ConfigFileAuthenticationDetailsProvider(properties.configProfile());
            case INSTANCE_PRINCIPAL -> InstancePrincipalsAuthenticationDetailsProvider.builder().build();
        };
    }
}
