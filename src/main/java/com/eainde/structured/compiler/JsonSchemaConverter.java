package com.eainde.structured.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a portable schema produced by {@link SchemaCompiler} into
 * LangChain4j's {@link JsonSchema}, for chat models that accept a native
 * response format.
 *
 * <p>
 * LangChain4j elements have no slot for default values, so an optional
 * field's default is appended to its description instead. A node without a
 * {@code type} but with {@code properties} is read as an object.
 */
public final class JsonSchemaConverter {

    private static final String ROOT = "$";

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(CompiledSchema compiled) {
        return toLangChainSchema(compiled.schemaName(), compiled.portableSchema());
    }

    /**
     * @throws IllegalArgumentException if the schema is not an object or uses a
     *                                  type the compiler never emits
     */
    public static JsonSchema toLangChainSchema(String name, JsonNode portableSchema) {
        if (portableSchema == null || !portableSchema.isObject()) {
            throw new IllegalArgumentException("portable schema must be a JSON object");
        }
        String schemaName = name;
        if (schemaName == null) {
            schemaName = portableSchema.path("title").asText("Schema");
        }
        return JsonSchema.builder()
                .name(schemaName)
                .rootElement(toElement(portableSchema, ROOT))
                .build();
    }

    private static JsonSchemaElement toElement(JsonNode node, String path) {
        String description = describe(node);
        if (node.has("enum")) {
            List<String> values = new ArrayList<>();
            node.get("enum").forEach(v -> values.add(v.asText()));
            return JsonEnumSchema.builder().description(description).enumValues(values).build();
        }

        String type = node.path("type").asText(node.has("properties") ? "object" : "");
        switch (type) {
            case "object":
                return toObject(node, description, path);
            case "array":
                JsonNode items = node.get("items");
                return JsonArraySchema.builder()
                        .description(description)
                        .items(items != null ? toElement(items, path + "[]") : JsonStringSchema.builder().build())
                        .build();
            case "string":
                return JsonStringSchema.builder().description(description).build();
            case "integer":
                return JsonIntegerSchema.builder().description(description).build();
            case "number":
                return JsonNumberSchema.builder().description(description).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            default:
                throw new IllegalArgumentException("unsupported schema type '" + type + "' at " + path);
        }
    }

    private static JsonObjectSchema toObject(JsonNode node, String description, String path) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        node.path("properties").fields().forEachRemaining(property ->
                builder.addProperty(property.getKey(), toElement(property.getValue(), path + "." + property.getKey())));

        JsonNode required = node.get("required");
        if (required != null && required.isArray()) {
            List<String> names = new ArrayList<>(required.size());
            required.forEach(n -> names.add(n.asText()));
            builder.required(names);
        }
        return builder.build();
    }

    private static String describe(JsonNode node) {
        String text = node.hasNonNull("description") ? node.get("description").asText() : null;
        if (!node.has("default")) {
            return text;
        }
        String defaultText = "default: " + node.get("default");
        return text == null || text.isBlank() ? defaultText : text + " (" + defaultText + ")";
    }
}
