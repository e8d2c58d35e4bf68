package no.cantara.skos.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime.
 */
final class LogLevels {

    static final String BASE_LOGGER = "no.cantara.skos";

    private LogLevels() {}

    /** Raises the cleaner's loggers to DEBUG. No-op when Logback is not the SLF4J binding. */
    static void verbose() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext ctx) {
            ctx.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
        }
    }
}
