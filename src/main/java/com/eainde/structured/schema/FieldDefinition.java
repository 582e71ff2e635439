package com.eainde.structured.schema;

import com.eainde.structured.instance.Value;

/**
 * A field as supplied by runtime metadata, before it is bound to a name.
 *
 * @param type         declared type
 * @param description  description for the backend
 * @param required     whether the field must be present
 * @param defaultValue default for optional fields; null is read as {@link Value#NULL}
 */
public record FieldDefinition(TypeTag type, String description, boolean required, Value defaultValue) {

    public static FieldDefinition required(TypeTag type, String description) {
        return new FieldDefinition(type, description, true, null);
    }

    public static FieldDefinition optional(TypeTag type, String description, Value defaultValue) {
        return new FieldDefinition(type, description, false, defaultValue);
    }

    FieldSpec toFieldSpec(String name) {
        if (required) {
            return FieldSpec.required(name, type, description);
        }
        return FieldSpec.optional(name, type, description, defaultValue == null ? Value.NULL : defaultValue);
    }
}
