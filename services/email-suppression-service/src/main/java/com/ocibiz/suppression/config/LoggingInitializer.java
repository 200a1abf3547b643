package com.ocibiz.suppression.config;

import com.ocibiz.observability.LogFormat;
import com.ocibiz.observability.LogLevel;
import com.ocibiz.observability.LoggingConfigurer;
import com.ocibiz.observability.LoggingSettings;
import com.ocibiz.observability.StructuredLogger;
import java.util.Map;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.boot.context.logging.LoggingApplicationListener;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.ApplicationListener;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;

/**
 * Installs the structured logging sink once the environment is available.
 *
 * <p>Runs right after Spring Boot's own {@link LoggingApplicationListener}, so the settings bound
 * from {@code ocibiz.logging.*} replace Boot's console appender instead of competing with it.
 * Registered through {@code META-INF/spring.factories} because it must run before the application
 * context, and therefore any bean, exists.
 *
 * <p>Invalid values never fail startup. They fall back to the defaults of {@link LoggingSettings}
 * and a warning naming the rejected value is logged through the new sink.
 */
public class LoggingInitializer
        implements ApplicationListener<ApplicationEnvironmentPreparedEvent>, Ordered {

    public static final int ORDER = LoggingApplicationListener.DEFAULT_ORDER + 1;

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        initialize(event.getEnvironment());
    }

    /** Binds the logging properties from the environment and configures the sink. */
    public static LoggingSettings initialize(ConfigurableEnvironment environment) {
        LoggingProperties properties =
                Binder.get(environment)
                        .bind(LoggingProperties.PREFIX, LoggingProperties.class)
                        .orElseGet(LoggingProperties::defaults);
        LoggingSettings settings = properties.toSettings();
        LoggingConfigurer.configure(settings);

        StructuredLogger log = StructuredLogger.getLogger(LoggingInitializer.class);
        if (LogLevel.fromName(properties.level()).isEmpty()) {
            log.warning(
                    "Unrecognized log level, using default",
                    Map.of("configured", properties.level(), "effective", settings.level().label()));
        }
        if (LogFormat.fromName(properties.format()).isEmpty()) {
            log.warning(
                    "Unrecognized log format, using default",
                    Map.of("configured", properties.format(), "effective", settings.format().name()));
        }
        log.debug(
                "Logging configured",
                Map.of("level", settings.level().label(), "format", settings.format().name()));
        return settings;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
