package com.eainde.structured.schema;

import com.eainde.structured.instance.Value;

/**
 * Declaration of a single schema field.
 *
 * @param name         field name, unique within the owning schema
 * @param type         declared type
 * @param description  natural language description shown to the backend
 * @param required     whether the field must be present in the output
 * @param defaultValue value used when an optional field is absent; never null
 *                     for optional fields ({@link Value#NULL} stands for JSON
 *                     null), always null for required fields
 */
public record FieldSpec(
        String name,
        TypeTag type,
        String description,
        boolean required,
        Value defaultValue
) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name must not be null or blank");
        }
        description = description == null ? "" : description;
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required field '" + name + "' cannot declare a default");
        }
        if (!required && defaultValue == null) {
            throw new IllegalArgumentException("optional field '" + name + "' must declare a default");
        }
    }

    public static FieldSpec required(String name, TypeTag type, String description) {
        return new FieldSpec(name, type, description, true, null);
    }

    /**
     * Optional field that resolves to JSON null when absent.
     */
    public static FieldSpec optional(String name, TypeTag type, String description) {
        return new FieldSpec(name, type, description, false, Value.NULL);
    }

    public static FieldSpec optional(String name, TypeTag type, String description, Value defaultValue) {
        return new FieldSpec(name, type, description, false, defaultValue);
    }
}
