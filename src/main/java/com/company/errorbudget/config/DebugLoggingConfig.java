package com.company.errorbudget.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * errorbudget.debug=true turns on DEBUG for the application's own loggers.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(value = "errorbudget.debug", havingValue = "true")
public class DebugLoggingConfig {

    static final String APPLICATION_LOGGER = "com.company.errorbudget";

    private final LoggingSystem loggingSystem;

    public DebugLoggingConfig(LoggingSystem loggingSystem) {
        this.loggingSystem = loggingSystem;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void enableDebugLogging() {
        loggingSystem.setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        log.info("Debug logging enabled for {}", APPLICATION_LOGGER);
    }
}
