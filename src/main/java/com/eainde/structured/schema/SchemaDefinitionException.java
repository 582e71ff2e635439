package com.eainde.structured.schema;

/**
 * Unchecked exception raised while a schema is being assembled.
 *
 * <p>
 * Schema problems are programming or configuration errors: they are raised
 * synchronously at build time and never enter the extraction retry loop.
 */
public class SchemaDefinitionException extends RuntimeException {

    /** Classifies the defect found in the schema. */
    public enum Kind {
        /** Two fields of the same schema share a name. */
        DUPLICATE_FIELD,
        /** A type tag is missing, malformed or names an unknown nested schema. */
        UNSUPPORTED_TYPE,
        /** A nested schema refers back to an enclosing schema. */
        CYCLIC_SCHEMA
    }

    private final Kind kind;
    private final String schemaName;
    private final String fieldName;

    public SchemaDefinitionException(Kind kind, String schemaName, String fieldName, String message) {
        super(message);
        this.kind = kind;
        this.schemaName = schemaName;
        this.fieldName = fieldName;
    }

    public static SchemaDefinitionException duplicateField(String schemaName, String fieldName) {
        return new SchemaDefinitionException(Kind.DUPLICATE_FIELD, schemaName, fieldName,
                "Schema '" + schemaName + "' declares field '" + fieldName + "' more than once");
    }

    public static SchemaDefinitionException unsupportedType(String schemaName, String fieldName, String detail) {
        return new SchemaDefinitionException(Kind.UNSUPPORTED_TYPE, schemaName, fieldName,
                "Unsupported type for field '" + fieldName + "' in schema '" + schemaName + "': " + detail);
    }

    public static SchemaDefinitionException cyclicSchema(String schemaName, String fieldName) {
        return new SchemaDefinitionException(Kind.CYCLIC_SCHEMA, schemaName, fieldName,
                "Field '" + fieldName + "' of schema '" + schemaName + "' nests schema '" + schemaName + "' again");
    }

    public Kind getKind() {
        return kind;
    }

    public String getSchemaName() {
        return schemaName;
    }

    /**
     * @return the offending field, or null when the defect is not tied to one field
     */
    public String getFieldName() {
        return fieldName;
    }
}
