package com.eainde.structured.validation;

import com.eainde.structured.instance.Instance;
import com.eainde.structured.instance.Value;
import com.eainde.structured.schema.FieldSpec;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.schema.TypeTag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Parses raw backend output and type-checks it against a {@link SchemaDefinition}.
 *
 * <p>
 * Validation never stops at the first problem: every declared field is checked
 * and all errors are returned in declaration order, nested and element errors
 * inline with their parent. No coercion is performed, so {@code "30"} is not an
 * integer. Undeclared keys are ignored unless the validator is strict.
 *
 * <p>
 * Thread-safe; one validator can serve concurrent extraction calls.
 */
@Slf4j
public class ResponseValidator {

    private final ObjectReader reader;
    private final boolean strictUnknownFields;

    public ResponseValidator(boolean strictUnknownFields) {
        this(new ObjectMapper(), strictUnknownFields);
    }

    public ResponseValidator(ObjectMapper objectMapper, boolean strictUnknownFields) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.strictUnknownFields = strictUnknownFields;
    }

    public boolean isStrictUnknownFields() {
        return strictUnknownFields;
    }

    /**
     * Parses {@code rawOutput} and validates the resulting object against {@code schema}.
     */
    public ValidationOutcome<Instance> validate(String rawOutput, SchemaDefinition schema) {
        ValidationOutcome<JsonNode> parsed = parse(rawOutput);
        if (!(parsed instanceof ValidationOutcome.Valid<JsonNode> document)) {
            return ValidationOutcome.invalid(parsed.errors());
        }
        if (!document.value().isObject()) {
            return ValidationOutcome.invalid(List.of(ValidationError.parseFailure(
                    "expected a JSON object but got " + nodeType(document.value()), rawOutput)));
        }
        ValidationOutcome<Instance> outcome = validateObject(document.value(), schema, List.of());
        if (!outcome.isValid()) {
            log.debug("Output for schema '{}' failed validation with {} error(s)", schema.getName(), outcome.errors().size());
        }
        return outcome;
    }

    /**
     * Parses {@code rawOutput} as JSON, unwrapping a surrounding markdown code
     * fence first. Any root type is accepted.
     */
    public ValidationOutcome<JsonNode> parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return ValidationOutcome.invalid(List.of(ValidationError.parseFailure("response is empty", null)));
        }
        String payload = JsonPayloadExtractor.unwrap(rawOutput);
        try {
            JsonNode document = reader.readTree(payload);
            if (document == null || document.isMissingNode()) {
                return ValidationOutcome.invalid(List.of(ValidationError.parseFailure("response is empty", rawOutput)));
            }
            return ValidationOutcome.valid(document);
        } catch (JsonProcessingException e) {
            return ValidationOutcome.invalid(List.of(ValidationError.parseFailure(
                    "response is not valid JSON: " + e.getOriginalMessage(), rawOutput)));
        }
    }

    /**
     * Validates an already parsed node against {@code schema}.
     *
     * @param pathPrefix segments prepended to every error path
     */
    public ValidationOutcome<Instance> validateObject(JsonNode node, SchemaDefinition schema, List<String> pathPrefix) {
        List<ValidationError> errors = new ArrayList<>();
        if (node == null || !node.isObject()) {
            String actual = node == null ? "nothing" : nodeType(node);
            errors.add(ValidationError.typeMismatch(pathPrefix, "object " + schema.getName(),
                    node == null ? null : node.toString(), actual));
            return ValidationOutcome.invalid(errors);
        }
        Instance instance = checkObject(node, schema, pathPrefix, errors);
        return errors.isEmpty() ? ValidationOutcome.valid(instance) : ValidationOutcome.invalid(errors);
    }

    // -------------------------------------------------------------------------
    // Recursive checks
    // -------------------------------------------------------------------------

    private Instance checkObject(JsonNode node, SchemaDefinition schema, List<String> path, List<ValidationError> errors) {
        Instance.Builder builder = Instance.builder();

        for (FieldSpec field : schema.fields()) {
            List<String> fieldPath = append(path, field.name());
            JsonNode value = node.get(field.name());

            if (value == null) {
                if (field.required()) {
                    errors.add(ValidationError.missingField(fieldPath));
                } else {
                    builder.put(field.name(), field.defaultValue());
                }
                continue;
            }
            if (value.isNull()) {
                if (field.required()) {
                    errors.add(ValidationError.typeMismatch(fieldPath, expected(field.type()), "null", "null"));
                } else {
                    builder.put(field.name(), Value.NULL);
                }
                continue;
            }

            Value checked = checkValue(value, field.type(), fieldPath, errors);
            if (checked != null) {
                builder.put(field.name(), checked);
            }
        }

        if (strictUnknownFields) {
            Iterator<String> keys = node.fieldNames();
            while (keys.hasNext()) {
                String key = keys.next();
                if (!schema.hasField(key)) {
                    errors.add(ValidationError.unknownField(append(path, key), node.get(key).toString()));
                }
            }
        }
        return builder.build();
    }

    /**
     * @return the checked value, or null when errors were recorded
     */
    private Value checkValue(JsonNode node, TypeTag type, List<String> path, List<ValidationError> errors) {
        if (type instanceof TypeTag.StringType) {
            if (node.isTextual()) return new Value.StringValue(node.textValue());
        } else if (type instanceof TypeTag.IntegerType) {
            if (node.isIntegralNumber() && node.canConvertToLong()) return new Value.IntegerValue(node.longValue());
        } else if (type instanceof TypeTag.NumberType) {
            if (node.isNumber()) return new Value.NumberValue(node.doubleValue());
        } else if (type instanceof TypeTag.BooleanType) {
            if (node.isBoolean()) return new Value.BooleanValue(node.booleanValue());
        } else if (type instanceof TypeTag.EnumOf enumOf) {
            if (node.isTextual()) {
                if (enumOf.values().contains(node.textValue())) {
                    return new Value.StringValue(node.textValue());
                }
                errors.add(new ValidationError(path, ErrorKind.TYPE_MISMATCH,
                        "expected one of " + enumOf.values() + " but got " + node, node.toString()));
                return null;
            }
        } else if (type instanceof TypeTag.ArrayOf array) {
            if (node.isArray()) return checkArray(node, array.items(), path, errors);
        } else if (type instanceof TypeTag.NestedSchema nested) {
            if (node.isObject()) {
                int before = errors.size();
                Instance instance = checkObject(node, nested.schema(), path, errors);
                return errors.size() == before ? new Value.ObjectValue(instance) : null;
            }
        }

        errors.add(ValidationError.typeMismatch(path, expected(type), node.toString(), nodeType(node)));
        return null;
    }

    private Value checkArray(JsonNode node, TypeTag itemType, List<String> path, List<ValidationError> errors) {
        int before = errors.size();
        List<Value> items = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            List<String> itemPath = indexed(path, i);
            if (item.isNull()) {
                errors.add(ValidationError.typeMismatch(itemPath, expected(itemType), "null", "null"));
                continue;
            }
            Value checked = checkValue(item, itemType, itemPath, errors);
            if (checked != null) {
                items.add(checked);
            }
        }
        return errors.size() == before ? new Value.ArrayValue(items) : null;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static List<String> append(List<String> path, String segment) {
        List<String> result = new ArrayList<>(path.size() + 1);
        result.addAll(path);
        result.add(segment);
        return result;
    }

    /**
     * Replaces the last segment {@code name} with {@code name[index]}.
     */
    private static List<String> indexed(List<String> path, int index) {
        if (path.isEmpty()) {
            return List.of("[" + index + "]");
        }
        List<String> result = new ArrayList<>(path);
        int last = result.size() - 1;
        result.set(last, result.get(last) + "[" + index + "]");
        return result;
    }

    private static String expected(TypeTag type) {
        if (type instanceof TypeTag.NestedSchema nested) {
            return "object " + nested.schema().getName();
        }
        if (type instanceof TypeTag.EnumOf enumOf) {
            return "one of " + enumOf.values();
        }
        return type.displayName();
    }

    /**
     * @return the JSON type name of {@code node} as used in error messages
     */
    public static String nodeType(JsonNode node) {
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isIntegralNumber()) return "integer";
        if (node.isNumber()) return "number";
        if (node.isBoolean()) return "boolean";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }
}
