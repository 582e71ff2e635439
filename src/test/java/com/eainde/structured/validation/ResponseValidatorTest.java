package com.eainde.structured.validation;

import com.eainde.structured.TestSchemas;
import com.eainde.structured.instance.Instance;
import com.eainde.structured.instance.Value;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseValidatorTest {

    private final ResponseValidator validator = new ResponseValidator(false);

    private static Instance valueOf(ValidationOutcome<Instance> outcome) {
        assertThat(outcome).isInstanceOf(ValidationOutcome.Valid.class);
        return ((ValidationOutcome.Valid<Instance>) outcome).value();
    }

    @Nested
    @DisplayName("Valid output")
    class ValidOutput {

        @Test
        @DisplayName("should build an instance and fill in defaults for absent optional fields")
        void userWithoutEmail() {
            ValidationOutcome<Instance> outcome = validator.validate("{\"name\":\"Jason\",\"age\":25}", TestSchemas.user());

            Instance user = valueOf(outcome);
            assertThat(user.getString("name")).isEqualTo("Jason");
            assertThat(user.getLong("age")).isEqualTo(25L);
            assertThat(user.isNull("email")).isTrue();
            assertThat(user.fieldNames()).containsExactly("name", "age", "email");
        }

        @Test
        @DisplayName("should accept an explicit null for an optional field")
        void explicitNull() {
            Instance user = valueOf(validator.validate(
                    "{\"name\":\"Jason\",\"age\":25,\"email\":null}", TestSchemas.user()));

            assertThat(user.get("email")).isEqualTo(Value.NULL);
        }

        @Test
        @DisplayName("should validate nested objects and arrays")
        void nested() {
            String raw = """
                    {"name": "Acme", "address": {"city": "Paris"}, "tags": ["b2b", "eu"]}""";

            Instance customer = valueOf(validator.validate(raw, TestSchemas.customer()));

            assertThat(customer.getInstance("address").getString("city")).isEqualTo("Paris");
            assertThat(customer.getInstance("address").getString("zip")).isEqualTo("00000");
            assertThat(customer.getList("tags")).containsExactly(Value.of("b2b"), Value.of("eu"));
            assertThat(customer.getDouble("score")).isEqualTo(0.5);
        }

        @Test
        @DisplayName("should accept an integer where a number is declared")
        void integerAsNumber() {
            String raw = "{\"name\":\"Acme\",\"address\":{\"city\":\"Paris\"},\"tags\":[],\"score\":4}";

            Instance customer = valueOf(validator.validate(raw, TestSchemas.customer()));

            assertThat(customer.getDouble("score")).isEqualTo(4.0);
        }

        @Test
        @DisplayName("should unwrap a markdown code fence")
        void codeFence() {
            String raw = "```json\n{\"name\":\"Jason\",\"age\":25}\n```";

            assertThat(validator.validate(raw, TestSchemas.user()).isValid()).isTrue();
        }

        @Test
        @DisplayName("should ignore undeclared keys when not strict")
        void lenientUnknownKeys() {
            String raw = "{\"name\":\"Jason\",\"age\":25,\"nickname\":\"J\"}";

            Instance user = valueOf(validator.validate(raw, TestSchemas.user()));

            assertThat(user.has("nickname")).isFalse();
        }
    }

    @Nested
    @DisplayName("Invalid output")
    class InvalidOutput {

        @Test
        @DisplayName("should report exactly one missing-field error for a missing age")
        void missingAge() {
            ValidationOutcome<Instance> outcome = validator.validate("{\"name\":\"Jason\"}", TestSchemas.user());

            assertThat(outcome.isValid()).isFalse();
            assertThat(outcome.errors()).hasSize(1);
            ValidationError error = outcome.errors().get(0);
            assertThat(error.fieldPath()).containsExactly("age");
            assertThat(error.kind()).isEqualTo(ErrorKind.MISSING_FIELD);
        }

        @Test
        @DisplayName("should not coerce a numeric string into an integer")
        void noCoercion() {
            ValidationOutcome<Instance> outcome = validator.validate(
                    "{\"name\":\"Jason\",\"age\":\"25\"}", TestSchemas.user());

            assertThat(outcome.errors()).singleElement().satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(error.fieldPath()).containsExactly("age");
                assertThat(error.message()).isEqualTo("expected integer but got string");
                assertThat(error.observedValue()).isEqualTo("\"25\"");
            });
        }

        @Test
        @DisplayName("should reject a fractional number for an integer field")
        void fractionalInteger() {
            ValidationOutcome<Instance> outcome = validator.validate(
                    "{\"name\":\"Jason\",\"age\":25.5}", TestSchemas.user());

            assertThat(outcome.errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("should reject null for a required field")
        void nullRequired() {
            ValidationOutcome<Instance> outcome = validator.validate(
                    "{\"name\":null,\"age\":25}", TestSchemas.user());

            assertThat(outcome.errors()).singleElement().satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(error.fieldPath()).containsExactly("name");
            });
        }

        @Test
        @DisplayName("should collect every error in declaration order with full paths")
        void collectsAll() {
            String raw = """
                    {"address": {"zip": 75001}, "tags": ["ok", 5, null]}""";

            ValidationOutcome<Instance> outcome = validator.validate(raw, TestSchemas.customer());

            assertThat(outcome.errors()).extracting(ValidationError::dottedPath)
                    .containsExactly("name", "address.city", "address.zip", "tags[1]", "tags[2]");
            assertThat(outcome.errors()).extracting(ValidationError::kind).containsExactly(
                    ErrorKind.MISSING_FIELD,
                    ErrorKind.MISSING_FIELD,
                    ErrorKind.TYPE_MISMATCH,
                    ErrorKind.TYPE_MISMATCH,
                    ErrorKind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("should reject a value outside the enum")
        void enumValue() {
            ValidationOutcome<Instance> outcome = validator.validate(
                    "{\"text\":\"cats\",\"kind\":\"audio\"}", TestSchemas.query());

            assertThat(outcome.errors()).singleElement().satisfies(error -> {
                assertThat(error.fieldPath()).containsExactly("kind");
                assertThat(error.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(error.message()).contains("web", "image", "video");
            });
        }

        @Test
        @DisplayName("should report unknown keys at every level when strict")
        void strictUnknownKeys() {
            ResponseValidator strict = new ResponseValidator(true);
            String raw = """
                    {"name": "Acme", "address": {"city": "Paris", "country": "FR"}, "tags": [], "vip": true}""";

            ValidationOutcome<Instance> outcome = strict.validate(raw, TestSchemas.customer());

            assertThat(strict.isStrictUnknownFields()).isTrue();
            assertThat(outcome.errors()).extracting(ValidationError::dottedPath).containsExactly("address.country", "vip");
            assertThat(outcome.errors()).extracting(ValidationError::kind).containsOnly(ErrorKind.UNKNOWN_FIELD);
        }
    }

    @Nested
    @DisplayName("Unparseable output")
    class Unparseable {

        @Test
        @DisplayName("should report a parse failure for malformed JSON")
        void malformed() {
            ValidationOutcome<Instance> outcome = validator.validate("{\"name\": \"Jason\",", TestSchemas.user());

            assertThat(outcome.errors()).singleElement().satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.PARSE_FAILURE);
                assertThat(error.isDocumentLevel()).isTrue();
                assertThat(error.message()).startsWith("response is not valid JSON");
            });
        }

        @Test
        @DisplayName("should report a parse failure for prose around the JSON")
        void trailingProse() {
            ValidationOutcome<Instance> outcome = validator.validate(
                    "{\"name\":\"Jason\",\"age\":25} hope this helps", TestSchemas.user());

            assertThat(outcome.errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.PARSE_FAILURE);
        }

        @Test
        @DisplayName("should report a parse failure for empty output")
        void empty() {
            ValidationOutcome<Instance> outcome = validator.validate("  ", TestSchemas.user());

            assertThat(outcome.errors()).singleElement()
                    .extracting(ValidationError::message).isEqualTo("response is empty");
        }

        @Test
        @DisplayName("should report a parse failure when the root is not an object")
        void arrayRoot() {
            ValidationOutcome<Instance> outcome = validator.validate("[1,2,3]", TestSchemas.user());

            assertThat(outcome.errors()).singleElement().satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.PARSE_FAILURE);
                assertThat(error.message()).contains("array");
            });
        }
    }

    @Test
    void validateObject_shouldPrefixPaths() throws Exception {
        // Arrange
        JsonNode node = new ObjectMapper().readTree("{\"name\":\"Jason\"}");

        // Act
        ValidationOutcome<Instance> outcome = validator.validateObject(node, TestSchemas.user(), List.of("calls[0]", "arguments"));

        // Assert
        assertThat(outcome.errors()).singleElement()
                .extracting(ValidationError::fieldPath).isEqualTo(List.of("calls[0]", "arguments", "age"));
    }
}
