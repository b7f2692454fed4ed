package tech.syncbridge.transform;

import tech.syncbridge.transform.mapping.ValidationRules;

import java.math.BigDecimal;
import java.net.URI;
import java.util.Collection;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks a coerced value against {@link ValidationRules}.
 */
final class ValueValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private ValueValidator() {
    }

    /**
     * @return the first violation, or empty if the value passes
     */
    static Optional<String> check(Object value, ValidationRules rules) {
        if (rules == null || value == null) {
            return Optional.empty();
        }
        String text = value instanceof Collection<?> ? null : value.toString();
        int length = value instanceof Collection<?> c ? c.size() : text.length();

        if (rules.minLength() != null && length < rules.minLength()) {
            return Optional.of("shorter than " + rules.minLength());
        }
        if (rules.maxLength() != null && length > rules.maxLength()) {
            return Optional.of("longer than " + rules.maxLength());
        }
        if (rules.pattern() != null && (text == null || !Pattern.compile(rules.pattern()).matcher(text).matches())) {
            return Optional.of("does not match pattern " + rules.pattern());
        }
        if (rules.minValue() != null || rules.maxValue() != null) {
            BigDecimal number = asNumber(value);
            if (number == null) {
                return Optional.of("not numeric");
            }
            if (rules.minValue() != null && number.compareTo(rules.minValue()) < 0) {
                return Optional.of("below minimum " + rules.minValue());
            }
            if (rules.maxValue() != null && number.compareTo(rules.maxValue()) > 0) {
                return Optional.of("above maximum " + rules.maxValue());
            }
        }
        if (rules.allowedValues() != null && !rules.allowedValues().isEmpty()
            && rules.allowedValues().stream().noneMatch(allowed -> Conditions.looselyEquals(allowed, value))) {
            return Optional.of("not one of " + rules.allowedValues());
        }
        if (Boolean.TRUE.equals(rules.email()) && (text == null || !EMAIL.matcher(text).matches())) {
            return Optional.of("not a valid email address");
        }
        if (Boolean.TRUE.equals(rules.url()) && (text == null || !isUrl(text))) {
            return Optional.of("not a valid URL");
        }
        return Optional.empty();
    }

    private static boolean isUrl(String text) {
        try {
            URI uri = URI.create(text);
            return uri.getScheme() != null && uri.getHost() != null
                && (uri.getScheme().equals("http") || uri.getScheme().equals("https"));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static BigDecimal asNumber(Object value) {
        try {
            return value instanceof BigDecimal d ? d : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
