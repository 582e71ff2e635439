package com.eainde.structured.compiler;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Output of {@link SchemaCompiler#compile}: the portable schema handed to the
 * generation backend and the prompt text describing the same fields.
 *
 * <p>
 * Instances are shared through the {@link CompilationCache}, so the portable
 * schema accessor hands out copies.
 *
 * @param schemaName     name of the compiled schema
 * @param portableSchema JSON-Schema-shaped object
 * @param promptText     human readable field enumeration
 */
public record CompiledSchema(String schemaName, ObjectNode portableSchema, String promptText) {

    public CompiledSchema {
        portableSchema = portableSchema.deepCopy();
    }

    @Override
    public ObjectNode portableSchema() {
        return portableSchema.deepCopy();
    }

    /**
     * @return the portable schema serialized as compact JSON
     */
    public String portableSchemaJson() {
        return portableSchema.toString();
    }
}
