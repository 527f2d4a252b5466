package de.mirkosertic.mcp.queryexplainer.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the running server, reported by {@code getServerInfo} and the MCP handshake.
 *
 * <p>Read once from the Maven-filtered {@code build-info.properties}. Runs from an IDE see the
 * placeholders unfiltered and report {@code dev} / {@code unknown}.</p>
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String RESOURCE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    public static BuildInfo current() {
        return Holder.INSTANCE;
    }

    static BuildInfo from(final @Nullable Properties properties) {
        if (properties == null) {
            return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
        }
        return new BuildInfo(
                filteredOrDefault(properties.getProperty("build.version"), DEV_VERSION),
                filteredOrDefault(properties.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP));
    }

    private static String filteredOrDefault(final @Nullable String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value;
    }

    private static final class Holder {

        private static final BuildInfo INSTANCE = load();

        private static BuildInfo load() {
            try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (input == null) {
                    logger.debug("{} not on classpath", RESOURCE);
                    return from(null);
                }
                final Properties properties = new Properties();
                properties.load(input);
                final BuildInfo info = from(properties);
                logger.debug("Build info: {}", info);
                return info;
            } catch (final IOException e) {
                logger.warn("Failed to read {}", RESOURCE, e);
                return from(null);
            }
        }
    }
}
