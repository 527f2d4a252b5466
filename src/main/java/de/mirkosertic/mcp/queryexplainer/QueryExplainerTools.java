package de.mirkosertic.mcp.queryexplainer;

import com.google.common.io.Resources;
import de.mirkosertic.mcp.queryexplainer.config.ApplicationConfig;
import de.mirkosertic.mcp.queryexplainer.config.BuildInfo;
import de.mirkosertic.mcp.queryexplainer.mcp.SchemaGenerator;
import de.mirkosertic.mcp.queryexplainer.mcp.ToolResultHelper;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueriesRequest;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueriesResponse;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueryFileRequest;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueryRequest;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueryResponse;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ServerInfoResponse;
import de.mirkosertic.mcp.queryexplainer.render.TreeMetrics;
import de.mirkosertic.mcp.queryexplainer.util.TextCleaner;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for explaining Lucene queries.
 */
public class QueryExplainerTools {

    private static final Logger logger = LoggerFactory.getLogger(QueryExplainerTools.class);

    static final String INTERNAL_ERROR = "Internal server error";

    private static final String EXPLAIN_DESCRIPTION = """
            Explain a Lucene query in plain language. Returns three renderings: \
            - deterministic_text: a fixed template form, e.g. 'Include items that match ANY of: (contains "a"; contains "b")' \
            - narrative_text: a natural language sentence, e.g. 'Search for documents containing any of the following: the term "a", the term "b".' \
            - ast_json: the parsed syntax tree as JSON with type, value, children and expr. \
            Supported syntax: terms, "phrases", AND, OR, NOT, -term, (grouping), field:term, field:(grouped terms). \
            Fuzzy, boost, proximity, range and regular expression syntax is parsed and echoed verbatim.""";

    static final String SYNTAX_GUIDE_URI = "guide://query-syntax";
    private static final String SYNTAX_GUIDE_RESOURCE = "query-syntax-guide.md";
    private static final String MARKDOWN = "text/markdown";

    private final QueryExplainer explainer;
    private final ApplicationConfig config;
    private final @Nullable ExplainCacheStats cacheStats;

    public QueryExplainerTools(final QueryExplainer explainer,
                               final ApplicationConfig config,
                               final @Nullable ExplainCacheStats cacheStats) {
        this.explainer = explainer;
        this.config = config;
        this.cacheStats = cacheStats;
    }

    public List<McpServerFeatures.SyncResourceSpecification> getResourceSpecifications() {
        final List<McpServerFeatures.SyncResourceSpecification> resources = new ArrayList<>();

        resources.add(new McpServerFeatures.SyncResourceSpecification(
                McpSchema.Resource.builder()
                        .uri(SYNTAX_GUIDE_URI)
                        .mimeType(MARKDOWN)
                        .name("Query Syntax Guide")
                        .description("Supported Lucene query syntax and how each construct is explained")
                        .build(),
                this::syntaxGuideResource
        ));

        return resources;
    }

    McpSchema.ReadResourceResult syntaxGuideResource(final @Nullable McpSyncServerExchange exchange,
                                                     final McpSchema.ReadResourceRequest request) {
        final URL url = Resources.getResource(SYNTAX_GUIDE_RESOURCE);
        try {
            final String markdown = Resources.toString(url, StandardCharsets.UTF_8);
            return new McpSchema.ReadResourceResult(
                    List.of(new McpSchema.TextResourceContents(SYNTAX_GUIDE_URI, MARKDOWN, markdown)));
        } catch (final IOException e) {
            logger.error("Error loading query syntax guide", e);
            return new McpSchema.ReadResourceResult(
                    List.of(new McpSchema.TextResourceContents(SYNTAX_GUIDE_URI, MARKDOWN, "")));
        }
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("explainQuery")
                        .description(EXPLAIN_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(ExplainQueryRequest.class))
                        .build())
                .callHandler((exchange, request) -> explainQuery(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("explainQueryFile")
                        .description("Explain the Lucene query stored in a UTF-8 text file. "
                                + "Invisible characters such as a byte order mark are removed and the content is trimmed. "
                                + "Returns the same renderings as explainQuery.")
                        .inputSchema(SchemaGenerator.generateSchema(ExplainQueryFileRequest.class))
                        .build())
                .callHandler((exchange, request) -> explainQueryFile(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("explainQueries")
                        .description("Explain several Lucene queries at once. Each entry reports whether the query is valid, "
                                + "its narrative and deterministic text and the depth of its syntax tree. "
                                + "A summary gives valid/invalid counts and average text lengths and tree depth. "
                                + "Maximum batch size: " + config.getBatchMaxQueries() + " queries.")
                        .inputSchema(SchemaGenerator.generateSchema(ExplainQueriesRequest.class))
                        .build())
                .callHandler((exchange, request) -> explainQueries(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getServerInfo")
                        .description("Health check. Returns status, server version, build timestamp and result cache metrics.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getServerInfo())
                .build());

        return tools;
    }

    McpSchema.CallToolResult explainQuery(final Map<String, Object> args) {
        final ExplainQueryRequest request = ExplainQueryRequest.fromMap(args);

        logger.info("Explain request: query='{}'", request.query());

        return ToolResultHelper.createResult(explain(request.query()));
    }

    McpSchema.CallToolResult explainQueryFile(final Map<String, Object> args) {
        final ExplainQueryFileRequest request = ExplainQueryFileRequest.fromMap(args);

        logger.info("Explain file request: path='{}'", request.path());

        if (request.path() == null || request.path().isBlank()) {
            return ToolResultHelper.createResult(ExplainQueryResponse.error("Path must not be empty"));
        }

        final String query;
        try {
            query = readQueryFile(Paths.get(request.path()));
        } catch (final InvalidPathException e) {
            logger.warn("Invalid path: {}", request.path());
            return ToolResultHelper.createResult(ExplainQueryResponse.error("Invalid path: " + e.getMessage()));
        } catch (final IOException e) {
            logger.warn("Cannot read query file {}: {}", request.path(), e.getMessage());
            return ToolResultHelper.createResult(ExplainQueryResponse.error("Cannot read file: " + e.getMessage()));
        }

        if (query.isEmpty()) {
            return ToolResultHelper.createResult(ExplainQueryResponse.error("File is empty"));
        }
        return ToolResultHelper.createResult(explain(query));
    }

    McpSchema.CallToolResult explainQueries(final Map<String, Object> args) {
        final ExplainQueriesRequest request = ExplainQueriesRequest.fromMap(args);

        if (request.queries() == null) {
            return ToolResultHelper.createResult(ExplainQueriesResponse.error("Parameter 'queries' must be a list of strings"));
        }

        logger.info("Batch explain request: {} queries", request.queries().size());

        if (request.queries().size() > config.getBatchMaxQueries()) {
            return ToolResultHelper.createResult(ExplainQueriesResponse.error(
                    "Too many queries: " + request.queries().size() + ", maximum is " + config.getBatchMaxQueries()));
        }

        try {
            final List<ExplainQueriesResponse.Entry> entries = new ArrayList<>(request.queries().size());
            for (final String query : request.queries()) {
                entries.add(explainEntry(query));
            }

            final ExplainQueriesResponse response = ExplainQueriesResponse.success(entries);
            logger.info("Batch explained: {} valid, {} invalid",
                    response.summary().validQueries(), response.summary().invalidQueries());
            return ToolResultHelper.createResult(response);

        } catch (final RuntimeException e) {
            logger.error("Error explaining query batch", e);
            return ToolResultHelper.createResult(ExplainQueriesResponse.error(INTERNAL_ERROR));
        }
    }

    McpSchema.CallToolResult getServerInfo() {
        logger.info("Server info request");

        final ServerInfoResponse.CacheMetrics cacheMetrics = cacheStats != null
                ? ServerInfoResponse.CacheMetrics.from(config.getCacheMaxSize(), cacheStats)
                : null;

        final BuildInfo buildInfo = BuildInfo.current();
        return ToolResultHelper.createResult(
                ServerInfoResponse.success(buildInfo.version(), buildInfo.buildTimestamp(), cacheMetrics));
    }

    private ExplainQueryResponse explain(final String query) {
        try {
            final QueryResult result = explainer.parse(query);
            logger.info("Explained query: {}", result.narrativeText());
            return ExplainQueryResponse.success(result);

        } catch (final QuerySyntaxException e) {
            logger.warn("Rejected query: {}", e.getMessage());
            return ExplainQueryResponse.error(e.getMessage());
        } catch (final RuntimeException e) {
            logger.error("Error explaining query", e);
            return ExplainQueryResponse.error(INTERNAL_ERROR);
        }
    }

    private ExplainQueriesResponse.Entry explainEntry(final String query) {
        try {
            final QueryResult result = explainer.parse(query);
            return ExplainQueriesResponse.Entry.valid(query, result.narrativeText(),
                    result.deterministicText(), TreeMetrics.depth(result.tree()));
        } catch (final QuerySyntaxException e) {
            logger.debug("Invalid query in batch: {}", e.getMessage());
            return ExplainQueriesResponse.Entry.invalid(query, e.getMessage());
        }
    }

    private String readQueryFile(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        final long size = Files.size(path);
        if (size > config.getFileMaxBytes()) {
            throw new IOException("File too large: " + size + " bytes, maximum is " + config.getFileMaxBytes());
        }
        final String content = Files.readString(path, StandardCharsets.UTF_8);
        return TextCleaner.clean(content);
    }
}
