package tech.syncbridge.transform.mapping;

/**
 * Predicate of a CONDITIONAL rule, evaluated against the source record.
 */
public record Condition(String field, ConditionOperator operator, Object value) {
}
