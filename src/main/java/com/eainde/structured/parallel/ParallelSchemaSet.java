package com.eainde.structured.parallel;

import com.eainde.structured.compiler.CompiledSchema;
import com.eainde.structured.compiler.SchemaCompiler;
import com.eainde.structured.instance.Instance;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.schema.SchemaDefinitionException;
import com.eainde.structured.validation.ErrorKind;
import com.eainde.structured.validation.ResponseValidator;
import com.eainde.structured.validation.ValidationError;
import com.eainde.structured.validation.ValidationOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A group of schemas the backend may answer with in a single response, one
 * call per extracted object.
 *
 * <p>
 * Expected output is either a bare array or an object wrapping it:
 * <pre>
 * {"calls": [
 *   {"name": "Weather", "arguments": {"city": "Paris"}},
 *   {"name": "Search",  "arguments": "{\"query\": \"museums\"}"}
 * ]}
 * </pre>
 * Arguments may arrive as an object or as a JSON-encoded string, the way
 * tool-call APIs deliver them.
 */
public class ParallelSchemaSet {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    static final String CALLS = "calls";

    private final String name;
    private final Map<String, SchemaDefinition> registry;

    public ParallelSchemaSet(String name, List<SchemaDefinition> schemas) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (schemas == null || schemas.isEmpty()) {
            throw new IllegalArgumentException("a parallel schema set needs at least one schema");
        }
        Map<String, SchemaDefinition> byName = new LinkedHashMap<>();
        for (SchemaDefinition schema : schemas) {
            if (byName.putIfAbsent(schema.getName(), schema) != null) {
                throw SchemaDefinitionException.duplicateField(name, schema.getName());
            }
        }
        this.name = name;
        this.registry = Collections.unmodifiableMap(byName);
    }

    public static ParallelSchemaSet of(String name, SchemaDefinition... schemas) {
        return new ParallelSchemaSet(name, List.of(schemas));
    }

    public String getName() {
        return name;
    }

    public List<SchemaDefinition> schemas() {
        return List.copyOf(registry.values());
    }

    public Optional<SchemaDefinition> schema(String schemaName) {
        return Optional.ofNullable(registry.get(schemaName));
    }

    /**
     * @return one function tool definition per schema, in declaration order
     */
    public ArrayNode toolDefinitions(SchemaCompiler compiler) {
        ArrayNode tools = NODES.arrayNode();
        for (SchemaDefinition schema : registry.values()) {
            ObjectNode tool = tools.addObject();
            tool.put("type", "function");
            ObjectNode function = tool.putObject("function");
            function.put("name", schema.getName());
            function.put("description", schema.getDoc());
            function.set("parameters", compiler.toPortableSchema(schema));
        }
        return tools;
    }

    /**
     * Compiles the set into a single wrapper schema whose {@code calls} array
     * holds {@code name}/{@code arguments} pairs; the prompt text describes
     * every member schema.
     */
    public CompiledSchema compile(SchemaCompiler compiler) {
        ObjectNode root = NODES.objectNode();
        root.put("title", name);
        root.put("description", "Zero or more calls, each naming one of: " + String.join(", ", registry.keySet()));
        root.put("type", "object");

        ObjectNode calls = root.putObject("properties").putObject(CALLS);
        calls.put("type", "array");
        ObjectNode call = calls.putObject("items");
        call.put("type", "object");
        ObjectNode callProperties = call.putObject("properties");
        ObjectNode nameProperty = callProperties.putObject("name");
        nameProperty.put("type", "string");
        nameProperty.put("description", "name of the schema the arguments conform to");
        ArrayNode names = nameProperty.putArray("enum");
        registry.keySet().forEach(names::add);
        ObjectNode arguments = callProperties.putObject("arguments");
        arguments.put("type", "object");
        arguments.put("description", "object conforming to the named schema");
        call.putArray("required").add("name").add("arguments");
        root.putArray("required").add(CALLS);

        StringBuilder prompt = new StringBuilder();
        prompt.append("Parallel extraction: ").append(name).append('\n');
        prompt.append("Answer with {\"calls\": [{\"name\": <schema name>, \"arguments\": <object>}, ...]}, ")
                .append("one call per extracted object, using these schemas:\n");
        for (SchemaDefinition schema : registry.values()) {
            prompt.append('\n').append(compiler.toPromptText(schema));
        }
        return new CompiledSchema(name, root, prompt.toString());
    }

    /**
     * Parses {@code rawOutput} and validates each call against the schema it names.
     *
     * @return the calls in response order, or every error found across all calls
     */
    public ValidationOutcome<List<NamedInstance>> validate(String rawOutput, ResponseValidator validator) {
        ValidationOutcome<JsonNode> parsed = validator.parse(rawOutput);
        if (!(parsed instanceof ValidationOutcome.Valid<JsonNode> document)) {
            return ValidationOutcome.invalid(parsed.errors());
        }
        JsonNode root = document.value();
        JsonNode calls;
        if (root.isArray()) {
            calls = root;
        } else if (root.isObject()) {
            calls = root.get(CALLS);
            if (calls == null) {
                return ValidationOutcome.invalid(List.of(ValidationError.missingField(List.of(CALLS))));
            }
            if (!calls.isArray()) {
                return ValidationOutcome.invalid(List.of(
                        ValidationError.typeMismatch(List.of(CALLS), "array", calls.toString(), ResponseValidator.nodeType(calls))));
            }
        } else {
            return ValidationOutcome.invalid(List.of(ValidationError.parseFailure(
                    "expected a JSON array of calls or an object with \"calls\" but got " + ResponseValidator.nodeType(root), rawOutput)));
        }

        List<NamedInstance> results = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            NamedInstance result = validateCall(calls.get(i), CALLS + "[" + i + "]", validator, errors);
            if (result != null) {
                results.add(result);
            }
        }
        return errors.isEmpty() ? ValidationOutcome.valid(results) : ValidationOutcome.invalid(errors);
    }

    private NamedInstance validateCall(JsonNode call, String segment, ResponseValidator validator,
                                       List<ValidationError> errors) {
        if (!call.isObject()) {
            errors.add(ValidationError.typeMismatch(List.of(segment), "object", call.toString(), ResponseValidator.nodeType(call)));
            return null;
        }

        List<String> namePath = List.of(segment, "name");
        JsonNode nameNode = call.get("name");
        SchemaDefinition schema = null;
        if (nameNode == null) {
            errors.add(ValidationError.missingField(namePath));
        } else if (!nameNode.isTextual()) {
            errors.add(ValidationError.typeMismatch(namePath, "string", nameNode.toString(), ResponseValidator.nodeType(nameNode)));
        } else {
            schema = registry.get(nameNode.asText());
            if (schema == null) {
                errors.add(new ValidationError(namePath, ErrorKind.UNKNOWN_FIELD,
                        "unknown schema name, expected one of " + registry.keySet(), nameNode.asText()));
            }
        }

        List<String> argumentsPath = List.of(segment, "arguments");
        JsonNode arguments = call.get("arguments");
        if (arguments == null) {
            errors.add(ValidationError.missingField(argumentsPath));
            return null;
        }
        if (schema == null) {
            return null;
        }
        if (arguments.isTextual()) {
            ValidationOutcome<JsonNode> decoded = validator.parse(arguments.asText());
            if (!(decoded instanceof ValidationOutcome.Valid<JsonNode> decodedArguments)) {
                decoded.errors().forEach(e -> errors.add(e.prefixed(argumentsPath)));
                return null;
            }
            arguments = decodedArguments.value();
        }

        ValidationOutcome<Instance> outcome = validator.validateObject(arguments, schema, argumentsPath);
        if (outcome instanceof ValidationOutcome.Valid<Instance> valid) {
            return new NamedInstance(schema, valid.value());
        }
        errors.addAll(outcome.errors());
        return null;
    }

    @Override
    public String toString() {
        return name + registry.keySet();
    }
}
