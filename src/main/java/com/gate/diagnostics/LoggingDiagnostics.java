package com.gate.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostics sink that writes warnings to SLF4J.
 */
public class LoggingDiagnostics implements Diagnostics {

    private final Logger log;

    public LoggingDiagnostics(Class<?> category) {
        this.log = LoggerFactory.getLogger(category);
    }

    @Override
    public void warn(String message) {
        log.warn(message);
    }
}
