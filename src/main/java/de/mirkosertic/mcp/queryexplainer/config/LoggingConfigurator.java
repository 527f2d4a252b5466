package de.mirkosertic.mcp.queryexplainer.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file logging when the server runs deployed.
 *
 * <p>STDOUT carries the MCP JSON-RPC stream and is never a log target. Development runs keep
 * logback.xml (STDERR). Deployed runs load {@value #DEPLOYED_CONFIG} with {@code LOG_DIR} set to
 * {@link ApplicationConfig#getLogDirectory()}. Logback is not usable yet while this runs, so
 * problems are reported on STDERR.</p>
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * @return false if deployed logging could not be set up, logging then stays on STDERR
     */
    public static boolean configure(final boolean deployedMode) {
        if (!deployedMode) {
            return true;
        }

        final URL config = LoggingConfigurator.class.getClassLoader().getResource(DEPLOYED_CONFIG);
        if (config == null) {
            System.err.println("Missing " + DEPLOYED_CONFIG + ", logging to stderr");
            return false;
        }

        final Path logDirectory = ApplicationConfig.getLogDirectory();
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Cannot create log directory " + logDirectory + ", logging to stderr: " + e.getMessage());
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty("LOG_DIR", logDirectory.toString());
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(config);
            return true;
        } catch (final JoranException e) {
            System.err.println("Invalid " + DEPLOYED_CONFIG + ": " + e.getMessage());
            return false;
        }
    }
}
