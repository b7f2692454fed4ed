package tech.syncbridge.transform;

import tech.syncbridge.transform.mapping.Condition;
import tech.syncbridge.transform.path.FieldPath;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Evaluates CONDITIONAL predicates.
 */
final class Conditions {

    private Conditions() {
    }

    static boolean evaluate(Condition condition, Map<String, Object> source) {
        Object actual = FieldPath.read(source, condition.field());
        Object expected = condition.value();
        return switch (condition.operator()) {
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
            case EQUALS -> looselyEquals(expected, actual);
            case NOT_EQUALS -> !looselyEquals(expected, actual);
            case CONTAINS -> contains(actual, expected);
            case GREATER_THAN -> compare(actual, expected) > 0;
            case LESS_THAN -> actual != null && compare(actual, expected) < 0;
            case MATCHES -> actual != null && expected != null
                && Pattern.compile(expected.toString()).matcher(actual.toString()).find();
            case IN -> expected instanceof Collection<?> options
                && options.stream().anyMatch(option -> looselyEquals(option, actual));
            case NOT_IN -> !(expected instanceof Collection<?> options)
                || options.stream().noneMatch(option -> looselyEquals(option, actual));
        };
    }

    /**
     * Equality that treats numerically equal numbers and their string forms as equal,
     * so {@code 1}, {@code 1.0} and {@code "1"} compare equal.
     */
    static boolean looselyEquals(Object expected, Object actual) {
        if (Objects.equals(expected, actual)) {
            return true;
        }
        if (expected == null || actual == null) {
            return false;
        }
        BigDecimal a = asNumber(expected);
        BigDecimal b = asNumber(actual);
        if (a != null && b != null) {
            return a.compareTo(b) == 0;
        }
        return expected.toString().equals(actual.toString());
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> looselyEquals(expected, item));
        }
        if (actual instanceof Map<?, ?> map) {
            return map.containsKey(expected.toString());
        }
        return actual.toString().contains(expected.toString());
    }

    // Null sorts below everything
    private static int compare(Object actual, Object expected) {
        if (actual == null) {
            return -1;
        }
        if (expected == null) {
            return 1;
        }
        BigDecimal a = asNumber(actual);
        BigDecimal b = asNumber(expected);
        if (a != null && b != null) {
            return a.compareTo(b);
        }
        return actual.toString().compareTo(expected.toString());
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Boolean) {
            return null;
        }
        try {
            return value instanceof BigDecimal d ? d : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
