package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * Optional value constraints checked after a rule's value has been coerced.
 * All fields are optional; {@code null} means "not checked".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationRules(
    Integer minLength,
    Integer maxLength,
    String pattern,
    BigDecimal minValue,
    BigDecimal maxValue,
    List<Object> allowedValues,
    Boolean email,
    Boolean url
) {

    public static ValidationRules none() {
        return new ValidationRules(null, null, null, null, null, null, null, null);
    }

    public static ValidationRules emailFormat() {
        return new ValidationRules(null, null, null, null, null, null, true, null);
    }

    public static ValidationRules length(Integer min, Integer max) {
        return new ValidationRules(min, max, null, null, null, null, null, null);
    }

    public static ValidationRules range(BigDecimal min, BigDecimal max) {
        return new ValidationRules(null, null, null, min, max, null, null, null);
    }

    public static ValidationRules pattern(String regex) {
        return new ValidationRules(null, null, regex, null, null, null, null, null);
    }

    public static ValidationRules oneOf(List<Object> values) {
        return new ValidationRules(null, null, null, null, null, values, null, null);
    }
}
