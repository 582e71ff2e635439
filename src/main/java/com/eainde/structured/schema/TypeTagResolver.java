package com.eainde.structured.schema;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves type names found in external metadata into {@link TypeTag}s.
 *
 * <p>
 * Recognised names: {@code string}, {@code integer} (or {@code int}),
 * {@code number}, {@code boolean} (or {@code bool}), {@code array<T>},
 * {@code enum(a|b|c)} and the name of any schema registered with
 * {@link #register(SchemaDefinition)}. Matching of the built-in names ignores case.
 */
public class TypeTagResolver {

    private final Map<String, SchemaDefinition> schemas = new LinkedHashMap<>();

    public TypeTagResolver register(SchemaDefinition schema) {
        SchemaDefinition previous = schemas.putIfAbsent(schema.getName(), schema);
        if (previous != null && !previous.equals(schema)) {
            throw new IllegalArgumentException(
                    "A different schema named '" + schema.getName() + "' is already registered");
        }
        return this;
    }

    /**
     * @param schemaName schema the type belongs to, used in error messages
     * @param fieldName  field the type belongs to, used in error messages
     * @param typeName   type expression to resolve
     * @throws SchemaDefinitionException with kind {@code UNSUPPORTED_TYPE} when the
     *                                   name cannot be resolved, or
     *                                   {@code CYCLIC_SCHEMA} when it names the
     *                                   schema being built
     */
    public TypeTag resolve(String schemaName, String fieldName, String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw SchemaDefinitionException.unsupportedType(schemaName, fieldName, "no type given");
        }
        String type = typeName.trim();
        String lower = type.toLowerCase();

        TypeTag primitive = switch (lower) {
            case "string", "str" -> TypeTag.STRING;
            case "integer", "int", "long" -> TypeTag.INTEGER;
            case "number", "float", "double" -> TypeTag.NUMBER;
            case "boolean", "bool" -> TypeTag.BOOLEAN;
            default -> null;
        };
        if (primitive != null) {
            return primitive;
        }

        if (lower.startsWith("array<") && lower.endsWith(">")) {
            String inner = type.substring("array<".length(), type.length() - 1);
            return TypeTag.arrayOf(resolve(schemaName, fieldName, inner));
        }
        if (lower.startsWith("enum(") && lower.endsWith(")")) {
            String inner = type.substring("enum(".length(), type.length() - 1);
            List<String> values = Arrays.stream(inner.split("\\|"))
                    .map(String::trim)
                    .filter(v -> !v.isEmpty())
                    .toList();
            if (values.isEmpty()) {
                throw SchemaDefinitionException.unsupportedType(schemaName, fieldName, "enum declares no values");
            }
            return new TypeTag.EnumOf(values);
        }
        if (type.equals(schemaName)) {
            throw SchemaDefinitionException.cyclicSchema(schemaName, fieldName);
        }
        SchemaDefinition nested = schemas.get(type);
        if (nested == null) {
            throw SchemaDefinitionException.unsupportedType(schemaName, fieldName,
                    "'" + type + "' is neither a built-in type nor a registered schema");
        }
        return TypeTag.nested(nested);
    }
}
