package com.eainde.structured.schema;

import java.util.List;

/**
 * Declared type of a schema field.
 *
 * <p>
 * The variant set is closed. {@link ArrayOf} and {@link NestedSchema} make the
 * type recursive, which is how nested object structures are described.
 */
public sealed interface TypeTag {

    TypeTag STRING = new StringType();
    TypeTag INTEGER = new IntegerType();
    TypeTag NUMBER = new NumberType();
    TypeTag BOOLEAN = new BooleanType();

    /**
     * @return the JSON type keyword this tag renders as ("string", "integer", ...)
     */
    String jsonType();

    /**
     * @return a compact human readable name, e.g. {@code array<string>}
     */
    String displayName();

    static TypeTag arrayOf(TypeTag items) {
        return new ArrayOf(items);
    }

    static TypeTag nested(SchemaDefinition schema) {
        return new NestedSchema(schema);
    }

    static TypeTag enumOf(String... values) {
        return new EnumOf(values == null ? null : List.of(values));
    }

    record StringType() implements TypeTag {
        @Override
        public String jsonType() {
            return "string";
        }

        @Override
        public String displayName() {
            return "string";
        }
    }

    record IntegerType() implements TypeTag {
        @Override
        public String jsonType() {
            return "integer";
        }

        @Override
        public String displayName() {
            return "integer";
        }
    }

    record NumberType() implements TypeTag {
        @Override
        public String jsonType() {
            return "number";
        }

        @Override
        public String displayName() {
            return "number";
        }
    }

    record BooleanType() implements TypeTag {
        @Override
        public String jsonType() {
            return "boolean";
        }

        @Override
        public String displayName() {
            return "boolean";
        }
    }

    /**
     * A sequence whose elements all conform to {@code items}.
     */
    record ArrayOf(TypeTag items) implements TypeTag {
        @Override
        public String jsonType() {
            return "array";
        }

        @Override
        public String displayName() {
            return "array<" + (items == null ? "?" : items.displayName()) + ">";
        }
    }

    /**
     * A structured sub-document validated against its own schema.
     */
    record NestedSchema(SchemaDefinition schema) implements TypeTag {
        @Override
        public String jsonType() {
            return "object";
        }

        @Override
        public String displayName() {
            return "object " + (schema == null ? "?" : schema.getName());
        }
    }

    /**
     * A string restricted to a fixed, ordered set of values.
     */
    record EnumOf(List<String> values) implements TypeTag {

        public EnumOf {
            values = values == null ? null : List.copyOf(values);
        }

        @Override
        public String jsonType() {
            return "string";
        }

        @Override
        public String displayName() {
            return "enum(" + (values == null ? "" : String.join("|", values)) + ")";
        }
    }
}
