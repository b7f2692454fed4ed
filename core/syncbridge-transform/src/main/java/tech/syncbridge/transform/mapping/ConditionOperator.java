package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Predicate operators usable in a CONDITIONAL rule.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    MATCHES("matches"),
    IN("in"),
    NOT_IN("not_in");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConditionOperator fromValue(String value) {
        for (ConditionOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + value);
    }

    /**
     * Operators that do not need a comparison value.
     */
    public boolean isUnary() {
        return this == EXISTS || this == NOT_EXISTS;
    }
}
