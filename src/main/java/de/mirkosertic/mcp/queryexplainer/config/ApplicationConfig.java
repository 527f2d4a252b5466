package de.mirkosertic.mcp.queryexplainer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the MCP Query Explainer.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpqueryexplainer/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_CACHE_ENABLED = "QUERY_EXPLAINER_CACHE_ENABLED";
    static final String ENV_CACHE_MAX_SIZE = "QUERY_EXPLAINER_CACHE_MAX_SIZE";
    static final String PROP_CACHE_ENABLED = "explainer.cache.enabled";
    static final String PROP_CACHE_MAX_SIZE = "explainer.cache.max-size";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpqueryexplainer";
    private static final String LOG_DIR = "log";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Result cache
    private boolean cacheEnabled = true;
    private long cacheMaxSize = 1000;

    // Tool limits
    private int batchMaxQueries = 100;
    private long fileMaxBytes = 64 * 1024;

    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(System.getenv());
    }

    static ApplicationConfig load(final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applySystemProperties();
        config.applyEnvironmentOverrides(environment);
        config.determineProfile();

        logger.info("Configuration loaded: cacheEnabled={}, cacheMaxSize={}, batchMaxQueries={}, deployedMode={}",
                config.cacheEnabled, config.cacheMaxSize, config.batchMaxQueries, config.deployedMode);

        return config;
    }

    /**
     * Defaults only, no files or environment. Used by tests and embedding code.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> explainerConfig = (Map<String, Object>) config.get("explainer");
        if (explainerConfig == null) {
            return;
        }

        final Map<String, Object> cacheConfig = (Map<String, Object>) explainerConfig.get("cache");
        if (cacheConfig != null) {
            if (cacheConfig.containsKey("enabled")) {
                this.cacheEnabled = (Boolean) cacheConfig.get("enabled");
            }
            if (cacheConfig.containsKey("max-size")) {
                this.cacheMaxSize = ((Number) cacheConfig.get("max-size")).longValue();
            }
        }

        final Map<String, Object> batchConfig = (Map<String, Object>) explainerConfig.get("batch");
        if (batchConfig != null && batchConfig.containsKey("max-queries")) {
            this.batchMaxQueries = ((Number) batchConfig.get("max-queries")).intValue();
        }

        final Map<String, Object> fileConfig = (Map<String, Object>) explainerConfig.get("file");
        if (fileConfig != null && fileConfig.containsKey("max-bytes")) {
            this.fileMaxBytes = ((Number) fileConfig.get("max-bytes")).longValue();
        }
    }

    private void applySystemProperties() {
        final String propCacheEnabled = System.getProperty(PROP_CACHE_ENABLED);
        if (propCacheEnabled != null && !propCacheEnabled.isBlank()) {
            this.cacheEnabled = Boolean.parseBoolean(propCacheEnabled.trim());
        }

        final String propCacheMaxSize = System.getProperty(PROP_CACHE_MAX_SIZE);
        if (propCacheMaxSize != null && !propCacheMaxSize.isBlank()) {
            this.cacheMaxSize = parseSize(propCacheMaxSize, PROP_CACHE_MAX_SIZE);
        }
    }

    private void applyEnvironmentOverrides(final Map<String, String> environment) {
        final String envCacheEnabled = environment.get(ENV_CACHE_ENABLED);
        if (envCacheEnabled != null && !envCacheEnabled.isBlank()) {
            this.cacheEnabled = Boolean.parseBoolean(envCacheEnabled.trim());
            logger.info("Cache enabled from environment: {}", this.cacheEnabled);
        }

        final String envCacheMaxSize = environment.get(ENV_CACHE_MAX_SIZE);
        if (envCacheMaxSize != null && !envCacheMaxSize.isBlank()) {
            this.cacheMaxSize = parseSize(envCacheMaxSize, ENV_CACHE_MAX_SIZE);
            logger.info("Cache max size from environment: {}", this.cacheMaxSize);
        }
    }

    private long parseSize(final String value, final String source) {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring invalid cache size '{}' from {}", value, source);
            return this.cacheMaxSize;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Target of the rolling log file in deployed mode.
     */
    public static Path getLogDirectory() {
        return getConfigDirectory().resolve(LOG_DIR);
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public int getBatchMaxQueries() {
        return batchMaxQueries;
    }

    public long getFileMaxBytes() {
        return fileMaxBytes;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
