package de.mirkosertic.mcp.queryexplainer;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.queryexplainer.config.ApplicationConfig;
import de.mirkosertic.mcp.queryexplainer.config.BuildInfo;
import de.mirkosertic.mcp.queryexplainer.config.LoggingConfigurator;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point for the MCP Query Explainer.
 * Wires the explanation pipeline and starts the MCP server using STDIO transport.
 */
public class QueryExplainerApplication {

    private static final Logger logger = LoggerFactory.getLogger(QueryExplainerApplication.class);

    /**
     * Offered during the handshake, newest first. The SDK's STDIO transport only offers 2024-11-05.
     */
    static final List<String> PROTOCOL_VERSIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05
    );

    private final QueryExplainerTools explainerTools;
    private McpSyncServer mcpServer;

    public QueryExplainerApplication(final ApplicationConfig config) {
        this.explainerTools = createTools(config);
    }

    static QueryExplainerTools createTools(final ApplicationConfig config) {
        final QueryExplainer pipeline = new DefaultQueryExplainer();
        if (!config.isCacheEnabled()) {
            logger.info("Result cache disabled");
            return new QueryExplainerTools(pipeline, config, null);
        }

        final CachingQueryExplainer cached =
                new CachingQueryExplainer(pipeline, config.getCacheMaxSize(), new ExplainCacheStats());
        logger.info("Result cache enabled with maximum size {}", config.getCacheMaxSize());
        return new QueryExplainerTools(cached, config, cached.getStats());
    }

    static StdioServerTransportProvider stdioTransport(final McpJsonMapper jsonMapper) {
        return new StdioServerTransportProvider(jsonMapper) {
            @Override
            public List<String> protocolVersions() {
                return PROTOCOL_VERSIONS;
            }
        };
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .resources(false, true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Query Explainer",
                BuildInfo.current().version()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

        mcpServer = McpServer.sync(stdioTransport(jsonMapper))
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(explainerTools.getToolSpecifications())
                .resources(explainerTools.getResourceSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    public void shutdown() {
        logger.info("Shutting down MCP Query Explainer...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        logger.info("MCP Query Explainer shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything logs
            final String profile = System.getProperty("spring.profiles.active", System.getProperty("profile", "default"));
            final boolean deployedMode = "deployed".equalsIgnoreCase(profile);
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (logging to stderr)");
                logger.info("User configuration: {}", ApplicationConfig.getUserConfigPath());
            }

            final QueryExplainerApplication app = new QueryExplainerApplication(config);
            app.start();

            logger.info("MCP Query Explainer finished.");

        } catch (final Exception e) {
            // In deployed mode there is no console appender
            System.err.println("Failed to start MCP Query Explainer: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
