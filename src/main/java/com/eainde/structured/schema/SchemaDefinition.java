package com.eainde.structured.schema;

import com.eainde.structured.instance.Instance;
import com.eainde.structured.instance.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named, ordered and immutable set of field declarations.
 *
 * <p>
 * A schema is built once and then reused across many extraction calls. Field
 * order drives rendering (portable schema, prompt text) but not validation,
 * which matches fields by name.
 *
 * <p>
 * Equality is structural: name plus ordered field list. Documentation text,
 * including that of nested schemas, does not take part.
 *
 * <p>
 * An optional field's default must conform to the field's type, since it is
 * copied into extracted instances as is.
 *
 * <pre>
 * SchemaDefinition user = SchemaDefinition.builder("User")
 *         .doc("A registered user")
 *         .field(FieldSpec.required("name", TypeTag.STRING, "Full name"))
 *         .field(FieldSpec.required("age", TypeTag.INTEGER, "Age in years"))
 *         .field(FieldSpec.optional("email", TypeTag.STRING, "Contact address"))
 *         .build();
 * </pre>
 */
public final class SchemaDefinition {

    private final String name;
    private final String doc;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> index;
    private final int hash;

    private SchemaDefinition(String name, String doc, List<FieldSpec> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("schema name must not be null or blank");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields must not be null");
        }
        this.name = name;
        this.doc = doc == null ? "" : doc;

        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (field == null) {
                throw new IllegalArgumentException("schema '" + name + "' contains a null field");
            }
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw SchemaDefinitionException.duplicateField(name, field.name());
            }
            checkType(field.name(), field.type());
            checkDefault(field);
        }

        this.fields = List.copyOf(fields);
        this.index = Collections.unmodifiableMap(byName);
        this.hash = Objects.hash(name, this.fields);
    }

    public static SchemaDefinition of(String name, String doc, List<FieldSpec> fields) {
        return new SchemaDefinition(name, doc, fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDoc() {
        return doc;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public Optional<FieldSpec> field(String fieldName) {
        return Optional.ofNullable(index.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return index.containsKey(fieldName);
    }

    public List<String> fieldNames() {
        return List.copyOf(index.keySet());
    }

    public List<String> requiredFieldNames() {
        return fields.stream()
                .filter(FieldSpec::required)
                .map(FieldSpec::name)
                .toList();
    }

    // -------------------------------------------------------------------------
    // Type checks
    // -------------------------------------------------------------------------

    private void checkType(String fieldName, TypeTag type) {
        if (type == null) {
            throw SchemaDefinitionException.unsupportedType(name, fieldName, "type is null");
        }
        if (type instanceof TypeTag.ArrayOf array) {
            checkType(fieldName, array.items());
        } else if (type instanceof TypeTag.NestedSchema nested) {
            if (nested.schema() == null) {
                throw SchemaDefinitionException.unsupportedType(name, fieldName, "nested schema is null");
            }
            if (nests(nested.schema(), name)) {
                throw SchemaDefinitionException.cyclicSchema(name, fieldName);
            }
        } else if (type instanceof TypeTag.EnumOf enumOf) {
            if (enumOf.values() == null || enumOf.values().isEmpty()) {
                throw SchemaDefinitionException.unsupportedType(name, fieldName, "enum declares no values");
            }
            Set<String> seen = new HashSet<>();
            for (String value : enumOf.values()) {
                if (!seen.add(value)) {
                    throw SchemaDefinitionException.unsupportedType(name, fieldName,
                            "enum declares '" + value + "' more than once");
                }
            }
        }
    }

    private void checkDefault(FieldSpec field) {
        Value defaultValue = field.defaultValue();
        if (defaultValue == null || defaultValue.isNull()) {
            return;
        }
        if (!conforms(field.type(), defaultValue)) {
            throw SchemaDefinitionException.unsupportedType(name, field.name(),
                    "default " + defaultValue.toJson() + " does not conform to " + field.type().displayName());
        }
    }

    /**
     * Mirrors what the response validator accepts: integral values pass for
     * number fields, array items are never null.
     */
    private static boolean conforms(TypeTag type, Value value) {
        if (type instanceof TypeTag.StringType) {
            return value instanceof Value.StringValue;
        }
        if (type instanceof TypeTag.IntegerType) {
            return value instanceof Value.IntegerValue;
        }
        if (type instanceof TypeTag.NumberType) {
            return value instanceof Value.IntegerValue || value instanceof Value.NumberValue;
        }
        if (type instanceof TypeTag.BooleanType) {
            return value instanceof Value.BooleanValue;
        }
        if (type instanceof TypeTag.EnumOf enumOf) {
            return value instanceof Value.StringValue s && enumOf.values().contains(s.value());
        }
        if (type instanceof TypeTag.ArrayOf array) {
            if (!(value instanceof Value.ArrayValue items)) {
                return false;
            }
            for (Value item : items.items()) {
                if (item.isNull() || !conforms(array.items(), item)) {
                    return false;
                }
            }
            return true;
        }
        if (type instanceof TypeTag.NestedSchema nested) {
            return value instanceof Value.ObjectValue object && conformsTo(nested.schema(), object.instance());
        }
        return false;
    }

    private static boolean conformsTo(SchemaDefinition schema, Instance instance) {
        for (String key : instance.fieldNames()) {
            if (!schema.hasField(key)) {
                return false;
            }
        }
        for (FieldSpec field : schema.fields) {
            if (!instance.has(field.name())) {
                if (field.required()) return false;
                continue;
            }
            Value value = instance.get(field.name());
            if (value.isNull() ? field.required() : !conforms(field.type(), value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Nested schemas were checked when they were built, so only the name of the
     * schema under construction has to be searched for.
     */
    private static boolean nests(SchemaDefinition schema, String schemaName) {
        if (schema.name.equals(schemaName)) {
            return true;
        }
        for (FieldSpec field : schema.fields) {
            if (typeNests(field.type(), schemaName)) {
                return true;
            }
        }
        return false;
    }

    private static boolean typeNests(TypeTag type, String schemaName) {
        if (type instanceof TypeTag.ArrayOf array) {
            return typeNests(array.items(), schemaName);
        }
        if (type instanceof TypeTag.NestedSchema nested) {
            return nests(nested.schema(), schemaName);
        }
        return false;
    }

    // -------------------------------------------------------------------------
    // Equality
    // -------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaDefinition other)) return false;
        return hash == other.hash && name.equals(other.name) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" {");
        for (int i = 0; i < fields.size(); i++) {
            FieldSpec field = fields.get(i);
            if (i > 0) sb.append(", ");
            sb.append(field.name()).append(':').append(field.type().displayName());
            if (!field.required()) sb.append('?');
        }
        return sb.append('}').toString();
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final String name;
        private String doc = "";
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder doc(String doc) {
            this.doc = doc;
            return this;
        }

        public Builder field(FieldSpec field) {
            this.fields.add(field);
            return this;
        }

        public Builder fields(List<FieldSpec> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public SchemaDefinition build() {
            return new SchemaDefinition(name, doc, fields);
        }
    }
}
