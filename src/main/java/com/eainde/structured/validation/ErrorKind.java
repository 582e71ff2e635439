package com.eainde.structured.validation;

/**
 * Why a piece of backend output was rejected.
 */
public enum ErrorKind {
    /** A required field is absent. */
    MISSING_FIELD,

    /** A value does not have the declared type. */
    TYPE_MISMATCH,

    /** A key is not declared by the schema (strict mode only). */
    UNKNOWN_FIELD,

    /** The output is not a parsable structured document. */
    PARSE_FAILURE
}
