package com.overlaychat.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * {@code --overlay.debug=true} also switches the relay's own loggers to DEBUG.
 */
@Component
public class DebugLogging {
    private static final Logger log = LoggerFactory.getLogger(DebugLogging.class);

    static final String RELAY_LOGGER = "com.overlaychat";

    public DebugLogging(LoggingSystem loggingSystem, @Value("${overlay.debug:false}") boolean debug) {
        if (debug) {
            loggingSystem.setLogLevel(RELAY_LOGGER, LogLevel.DEBUG);
            log.debug("[BOOT] debug mode, {} logging at DEBUG", RELAY_LOGGER);
        }
    }
}
