package com.eainde.structured.instance;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Extracted data for one schema: an ordered mapping from field name to {@link Value}.
 *
 * <p>
 * Instances produced by the validator hold every declared field, in schema
 * declaration order, with absent optional fields already resolved to their
 * defaults.
 */
public final class Instance {

    private final Map<String, Value> values;

    private Instance(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Instance empty() {
        return new Instance(Map.of());
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Map<String, Value> values() {
        return values;
    }

    /**
     * @throws NoSuchElementException if the field is not part of this instance
     */
    public Value get(String field) {
        Value value = values.get(field);
        if (value == null) {
            throw new NoSuchElementException("No field '" + field + "' in instance " + values.keySet());
        }
        return value;
    }

    public boolean isNull(String field) {
        return get(field).isNull();
    }

    /** @return the string value, or null for JSON null */
    public String getString(String field) {
        Value value = get(field);
        return value.isNull() ? null : as(field, value, Value.StringValue.class).value();
    }

    /** @return the integer value, or null for JSON null */
    public Long getLong(String field) {
        Value value = get(field);
        return value.isNull() ? null : as(field, value, Value.IntegerValue.class).value();
    }

    /**
     * Integral values are widened, so this works for both integer and number fields.
     *
     * @return the numeric value, or null for JSON null
     */
    public Double getDouble(String field) {
        Value value = get(field);
        if (value.isNull()) return null;
        if (value instanceof Value.IntegerValue i) return (double) i.value();
        return as(field, value, Value.NumberValue.class).value();
    }

    /** @return the boolean value, or null for JSON null */
    public Boolean getBoolean(String field) {
        Value value = get(field);
        return value.isNull() ? null : as(field, value, Value.BooleanValue.class).value();
    }

    /** @return the nested instance, or null for JSON null */
    public Instance getInstance(String field) {
        Value value = get(field);
        return value.isNull() ? null : as(field, value, Value.ObjectValue.class).instance();
    }

    /** @return the array items, or null for JSON null */
    public List<Value> getList(String field) {
        Value value = get(field);
        return value.isNull() ? null : as(field, value, Value.ArrayValue.class).items();
    }

    private static <V extends Value> V as(String field, Value value, Class<V> type) {
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Field '" + field + "' holds " + value.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> node.set(name, value.toJson()));
        return node;
    }

    /**
     * @return a mutable map of plain Java values, nulls included
     */
    public Map<String, Object> asMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((name, value) -> plain.put(name, value.unwrap()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instance other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    public static class Builder {
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String field, Value value) {
            values.put(field, value == null ? Value.NULL : value);
            return this;
        }

        public Builder put(String field, Object raw) {
            return put(field, Value.of(raw));
        }

        public Instance build() {
            return new Instance(values);
        }
    }
}
