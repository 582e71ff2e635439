package com.eainde.structured.compiler;

import com.eainde.structured.schema.FieldSpec;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.schema.TypeTag;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a {@link SchemaDefinition} into its portable (JSON Schema shaped)
 * form and into prompt text.
 *
 * <p>
 * Compilation is a pure function of the schema. Everything is emitted in field
 * declaration order, so compiling equal schemas yields byte-identical output.
 *
 * <p>Portable shape:</p>
 * <pre>
 * {
 *   "title": "User",
 *   "type": "object",
 *   "properties": {
 *     "name":  { "type": "string",  "description": "Full name" },
 *     "email": { "type": "string",  "description": "Contact address", "default": null }
 *   },
 *   "required": ["name"]
 * }
 * </pre>
 */
public class SchemaCompiler {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String INDENT = "  ";

    public CompiledSchema compile(SchemaDefinition schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        return new CompiledSchema(schema.getName(), toPortableSchema(schema), toPromptText(schema));
    }

    // -------------------------------------------------------------------------
    // Portable schema
    // -------------------------------------------------------------------------

    public ObjectNode toPortableSchema(SchemaDefinition schema) {
        ObjectNode root = NODES.objectNode();
        root.put("title", schema.getName());
        if (!schema.getDoc().isBlank()) {
            root.put("description", schema.getDoc());
        }
        root.put("type", "object");
        appendProperties(root, schema);
        return root;
    }

    private void appendProperties(ObjectNode target, SchemaDefinition schema) {
        ObjectNode properties = target.putObject("properties");
        for (FieldSpec field : schema.fields()) {
            ObjectNode property = renderType(field.type(), field.description());
            if (!field.required()) {
                property.set("default", field.defaultValue().toJson());
            }
            properties.set(field.name(), property);
        }
        ArrayNode required = target.putArray("required");
        schema.requiredFieldNames().forEach(required::add);
    }

    private ObjectNode renderType(TypeTag type, String description) {
        ObjectNode node = NODES.objectNode();
        node.put("type", type.jsonType());

        if (type instanceof TypeTag.NestedSchema nested) {
            SchemaDefinition schema = nested.schema();
            node.put("title", schema.getName());
            String text = description == null || description.isBlank() ? schema.getDoc() : description;
            if (!text.isBlank()) {
                node.put("description", text);
            }
            appendProperties(node, schema);
            return node;
        }

        if (description != null) {
            node.put("description", description);
        }
        if (type instanceof TypeTag.ArrayOf array) {
            node.set("items", renderType(array.items(), null));
        } else if (type instanceof TypeTag.EnumOf enumOf) {
            ArrayNode values = node.putArray("enum");
            enumOf.values().forEach(values::add);
        }
        return node;
    }

    // -------------------------------------------------------------------------
    // Prompt text
    // -------------------------------------------------------------------------

    public String toPromptText(SchemaDefinition schema) {
        StringBuilder sb = new StringBuilder();
        sb.append("Schema: ").append(schema.getName()).append('\n');
        if (!schema.getDoc().isBlank()) {
            sb.append(schema.getDoc()).append('\n');
        }
        sb.append("Fields:\n");
        appendFields(sb, schema, 0);
        return sb.toString();
    }

    private void appendFields(StringBuilder sb, SchemaDefinition schema, int depth) {
        for (FieldSpec field : schema.fields()) {
            sb.append(INDENT.repeat(depth))
                    .append("- ").append(field.name())
                    .append(" (").append(field.type().displayName());
            if (field.required()) {
                sb.append(", required");
            } else {
                sb.append(", optional, default: ").append(field.defaultValue().toJson());
            }
            sb.append(')');
            if (!field.description().isBlank()) {
                sb.append(": ").append(field.description());
            }
            sb.append('\n');

            SchemaDefinition nested = nestedSchemaOf(field.type());
            if (nested != null) {
                appendFields(sb, nested, depth + 1);
            }
        }
    }

    private static SchemaDefinition nestedSchemaOf(TypeTag type) {
        if (type instanceof TypeTag.NestedSchema nested) {
            return nested.schema();
        }
        if (type instanceof TypeTag.ArrayOf array) {
            return nestedSchemaOf(array.items());
        }
        return null;
    }
}
