package de.mirkosertic.mcp.queryexplainer.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the JSON Schema of a tool input from a request record.
 * <p>
 * Components annotated with {@link Nullable} are optional, all others are required. A
 * {@link Description} becomes the property description.
 * Supported component types are strings, numbers, booleans and lists of those.
 */
public final class SchemaGenerator {

    /**
     * Describes a request record component to the client.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.RECORD_COMPONENT)
    public @interface Description {
        String value();
    }

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            final Map<String, Object> property = new LinkedHashMap<>();
            final Description description = component.getAnnotation(Description.class);
            if (description != null) {
                property.put("description", description.value());
            }
            property.putAll(typeSchema(component.getGenericType()));
            properties.put(component.getName(), property);

            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static boolean isNullable(final RecordComponent component) {
        // @Nullable is a type-use annotation
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> typeSchema(final Type type) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        if (type instanceof ParameterizedType paramType
                && paramType.getRawType() instanceof Class<?> rawClass
                && List.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Type[] typeArgs = paramType.getActualTypeArguments();
            schema.put("items", typeArgs.length > 0 ? typeSchema(typeArgs[0]) : Map.of("type", "string"));
        } else if (type instanceof Class<?> clazz) {
            schema.put("type", scalarType(clazz));
        } else {
            schema.put("type", "string");
        }
        return schema;
    }

    private static String scalarType(final Class<?> clazz) {
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        if (clazz == String.class) {
            return "string";
        }
        return "object";
    }
}
