package com.eainde.structured.schema;

import com.eainde.structured.instance.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link SchemaDefinition} at runtime, optionally on top of an
 * existing base schema.
 *
 * <p>
 * New fields that collide with a base field fail with
 * {@link SchemaDefinitionException.Kind#DUPLICATE_FIELD} unless
 * {@link #override(boolean)} is set, in which case the new definition takes the
 * base field's position. The base schema is never modified.
 *
 * <pre>
 * SchemaDefinition extended = DynamicSchemaBuilder.extending(user)
 *         .field("nickname", FieldDefinition.optional(TypeTag.STRING, "Preferred name", Value.NULL))
 *         .build();
 * </pre>
 */
public class DynamicSchemaBuilder {

    private final SchemaDefinition base;
    private String name;
    private String doc;
    private boolean override;
    private final Map<String, FieldDefinition> additions = new LinkedHashMap<>();

    private DynamicSchemaBuilder(SchemaDefinition base, String name, String doc) {
        this.base = base;
        this.name = name;
        this.doc = doc;
    }

    public static DynamicSchemaBuilder create(String name) {
        return new DynamicSchemaBuilder(null, name, "");
    }

    public static DynamicSchemaBuilder extending(SchemaDefinition base) {
        if (base == null) {
            throw new IllegalArgumentException("base schema must not be null");
        }
        return new DynamicSchemaBuilder(base, base.getName(), base.getDoc());
    }

    public DynamicSchemaBuilder name(String name) {
        this.name = name;
        return this;
    }

    public DynamicSchemaBuilder doc(String doc) {
        this.doc = doc;
        return this;
    }

    public DynamicSchemaBuilder override(boolean override) {
        this.override = override;
        return this;
    }

    public DynamicSchemaBuilder field(String fieldName, FieldDefinition definition) {
        if (fieldName == null || definition == null) {
            throw new IllegalArgumentException("field name and definition must not be null");
        }
        additions.put(fieldName, definition);
        return this;
    }

    public DynamicSchemaBuilder fields(Map<String, FieldDefinition> definitions) {
        definitions.forEach(this::field);
        return this;
    }

    public SchemaDefinition build() {
        List<FieldSpec> fields = new ArrayList<>();
        Map<String, FieldDefinition> pending = new LinkedHashMap<>(additions);

        if (base != null) {
            for (FieldSpec existing : base.fields()) {
                FieldDefinition replacement = pending.remove(existing.name());
                if (replacement == null) {
                    fields.add(existing);
                } else if (override) {
                    fields.add(replacement.toFieldSpec(existing.name()));
                } else {
                    throw SchemaDefinitionException.duplicateField(name, existing.name());
                }
            }
        }
        pending.forEach((fieldName, definition) -> fields.add(definition.toFieldSpec(fieldName)));

        return SchemaDefinition.of(name, doc, fields);
    }

    /**
     * Builds a schema from configuration-style metadata.
     *
     * <p>
     * Each entry maps a field name to attributes: {@code type} (resolved through
     * {@code resolver}), {@code description}, {@code required} and
     * {@code default}. When {@code required} is absent the field is required
     * unless a {@code default} key is present.
     */
    public static SchemaDefinition fromMetadata(String name,
                                                String doc,
                                                Map<String, Map<String, Object>> metadata,
                                                TypeTagResolver resolver) {
        DynamicSchemaBuilder builder = create(name).doc(doc);
        metadata.forEach((fieldName, attributes) -> {
            Object type = attributes.get("type");
            TypeTag tag = resolver.resolve(name, fieldName, type == null ? null : type.toString());
            Object description = attributes.get("description");
            boolean hasDefault = attributes.containsKey("default");
            Object requiredFlag = attributes.get("required");
            boolean required = requiredFlag == null ? !hasDefault : Boolean.parseBoolean(requiredFlag.toString());

            builder.field(fieldName, new FieldDefinition(
                    tag,
                    description == null ? "" : description.toString(),
                    required,
                    required ? null : Value.of(attributes.get("default"))));
        });
        return builder.build();
    }
}
