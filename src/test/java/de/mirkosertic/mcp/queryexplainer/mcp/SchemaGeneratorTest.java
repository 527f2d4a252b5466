package de.mirkosertic.mcp.queryexplainer.mcp;

import de.mirkosertic.mcp.queryexplainer.mcp.SchemaGenerator.Description;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueriesRequest;
import de.mirkosertic.mcp.queryexplainer.mcp.dto.ExplainQueryRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaGeneratorTest {

    record OptionalParameters(
            @Description("Required text") String text,
            @Nullable @Description("Optional limit") Integer limit,
            @Nullable Boolean flag
    ) {
    }

    @Test
    @SuppressWarnings("unchecked")
    void stringParameterIsRequired() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(ExplainQueryRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("query");

        final Map<String, Object> query = (Map<String, Object>) schema.properties().get("query");
        assertThat(query.get("type")).isEqualTo("string");
        assertThat((String) query.get("description")).contains("Lucene query");
    }

    @Test
    @SuppressWarnings("unchecked")
    void listParameterBecomesArray() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(ExplainQueriesRequest.class);

        final Map<String, Object> queries = (Map<String, Object>) schema.properties().get("queries");
        assertThat(queries.get("type")).isEqualTo("array");
        assertThat((Map<String, Object>) queries.get("items")).containsEntry("type", "string");
    }

    @Test
    @SuppressWarnings("unchecked")
    void nullableParametersAreOptional() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(OptionalParameters.class);

        assertThat(schema.required()).containsExactly("text");
        assertThat((Map<String, Object>) schema.properties().get("limit")).containsEntry("type", "integer");
        assertThat((Map<String, Object>) schema.properties().get("flag")).containsEntry("type", "boolean");
    }

    @Test
    void emptySchemaHasNoProperties() {
        final McpSchema.JsonSchema schema = SchemaGenerator.emptySchema();

        assertThat(schema.properties()).isEmpty();
        assertThat(schema.required()).isEmpty();
    }
}
