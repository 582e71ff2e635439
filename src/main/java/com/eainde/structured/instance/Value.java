package com.eainde.structured.instance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Typed value held by an {@link Instance}.
 *
 * <p>
 * This is the tagged union used for data extracted against schemas that only
 * exist at runtime: instead of generating classes, every field value is one of
 * the variants below.
 */
public sealed interface Value {

    Value NULL = NullValue.INSTANCE;

    JsonNode toJson();

    /**
     * @return the plain Java representation: String, Long, Double, Boolean,
     *         List, Map or null
     */
    Object unwrap();

    default boolean isNull() {
        return false;
    }

    /**
     * Converts a plain Java object (as found in configuration maps) into a value.
     *
     * @throws IllegalArgumentException for types with no JSON counterpart
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof String s) {
            return new StringValue(s);
        }
        if (raw instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return new IntegerValue(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            return new NumberValue(n.doubleValue());
        }
        if (raw instanceof List<?> list) {
            List<Value> items = new ArrayList<>(list.size());
            list.forEach(item -> items.add(of(item)));
            return new ArrayValue(items);
        }
        if (raw instanceof Map<?, ?> map) {
            Instance.Builder builder = Instance.builder();
            map.forEach((k, v) -> builder.put(String.valueOf(k), of(v)));
            return new ObjectValue(builder.build());
        }
        throw new IllegalArgumentException("Cannot convert " + raw.getClass().getName() + " to a value");
    }

    static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new IntegerValue(node.longValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.doubleValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return new ArrayValue(items);
        }
        if (node.isObject()) {
            Instance.Builder builder = Instance.builder();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.put(field.getKey(), fromJson(field.getValue()));
            }
            return new ObjectValue(builder.build());
        }
        return new StringValue(node.asText());
    }

    record StringValue(String value) implements Value {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("use Value.NULL for null strings");
            }
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record IntegerValue(long value) implements Value {
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record NumberValue(double value) implements Value {
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements Value {
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }

        @Override
        public Object unwrap() {
            return value;
        }
    }

    record ArrayValue(List<Value> items) implements Value {
        public ArrayValue {
            items = List.copyOf(items);
        }

        @Override
        public JsonNode toJson() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            items.forEach(item -> array.add(item.toJson()));
            return array;
        }

        @Override
        public Object unwrap() {
            List<Object> plain = new ArrayList<>(items.size());
            items.forEach(item -> plain.add(item.unwrap()));
            return plain;
        }
    }

    record ObjectValue(Instance instance) implements Value {
        public ObjectValue {
            if (instance == null) {
                throw new IllegalArgumentException("use Value.NULL for null objects");
            }
        }

        @Override
        public ObjectNode toJson() {
            return instance.toJson();
        }

        @Override
        public Object unwrap() {
            return instance.asMap();
        }
    }

    enum NullValue implements Value {
        INSTANCE;

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.nullNode();
        }

        @Override
        public Object unwrap() {
            return null;
        }

        @Override
        public boolean isNull() {
            return true;
        }
    }
}
