package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a mapping rule. Determines how {@code transformConfig} is read.
 *
 * <ul>
 *   <li>IDENTITY - copy the source value, coerced to the rule's data type</li>
 *   <li>FUNCTION - {@code {"function": "normalize_email", "args": {...}}}</li>
 *   <li>CONSTANT - {@code {"value": ...}}</li>
 *   <li>CONDITIONAL - {@code {"condition": {...}, "then": rule, "else": rule}}</li>
 *   <li>LOOKUP - {@code {"table": {...}, "default": ..., "caseInsensitive": true}}</li>
 * </ul>
 */
public enum TransformType {
    IDENTITY("IDENTITY"),
    FUNCTION("FUNCTION"),
    CONSTANT("CONSTANT"),
    CONDITIONAL("CONDITIONAL"),
    LOOKUP("LOOKUP");

    private final String value;

    TransformType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TransformType fromValue(String value) {
        for (TransformType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transform type: " + value);
    }
}
