package tech.syncbridge.transform;

/**
 * Why a rule could not produce its target field.
 */
public enum ErrorReason {
    /** A required source field was missing or null. */
    REQUIRED_FIELD_MISSING,
    /** The value could not be converted to the rule's data type. */
    TYPE_COERCION_FAILED,
    /** A function rejected its input. */
    FUNCTION_FAILED,
    /** A validation rule was violated. */
    VALIDATION_FAILED,
    /** A required target field was absent after all rules ran. */
    TARGET_SCHEMA_VIOLATION
}
