package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed views over the opaque {@code transformConfig} of a rule.
 *
 * <p>All readers throw {@link IllegalArgumentException} for malformed configuration.
 * {@link MappingValidator} calls them at write time so the engine never sees a bad config.</p>
 */
public final class RuleConfigs {

    public static final String FUNCTION = "function";
    public static final String ARGS = "args";
    public static final String VALUE = "value";
    public static final String CONDITION = "condition";
    public static final String THEN = "then";
    public static final String ELSE = "else";
    public static final String TABLE = "table";
    public static final String DEFAULT = "default";
    public static final String CASE_INSENSITIVE = "caseInsensitive";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RuleConfigs() {
    }

    public static String functionName(MappingRule rule) {
        Object name = rule.transformConfig().get(FUNCTION);
        if (!(name instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("FUNCTION rule needs a 'function' name");
        }
        return s;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> functionArgs(MappingRule rule) {
        Object args = rule.transformConfig().get(ARGS);
        if (args == null) {
            return Map.of();
        }
        if (!(args instanceof Map)) {
            throw new IllegalArgumentException("'args' must be an object");
        }
        return (Map<String, Object>) args;
    }

    public static boolean hasConstant(MappingRule rule) {
        return rule.transformConfig().containsKey(VALUE);
    }

    public static Object constant(MappingRule rule) {
        return rule.transformConfig().get(VALUE);
    }

    public static ConditionalConfig conditional(MappingRule rule) {
        Map<String, Object> config = rule.transformConfig();
        Object rawCondition = config.get(CONDITION);
        if (!(rawCondition instanceof Map<?, ?> conditionMap)) {
            throw new IllegalArgumentException("CONDITIONAL rule needs a 'condition' object");
        }
        Object field = conditionMap.get("field");
        Object operator = conditionMap.get("operator");
        if (!(field instanceof String f) || f.isBlank()) {
            throw new IllegalArgumentException("condition needs a 'field'");
        }
        if (operator == null) {
            throw new IllegalArgumentException("condition needs an 'operator'");
        }
        ConditionOperator op = operator instanceof ConditionOperator o
            ? o
            : ConditionOperator.fromValue(operator.toString());
        Condition condition = new Condition(f, op, conditionMap.get("value"));

        MappingRule then = subRule(config.get(THEN), rule.targetField());
        if (then == null) {
            throw new IllegalArgumentException("CONDITIONAL rule needs a 'then' rule");
        }
        MappingRule otherwise = subRule(config.get(ELSE), rule.targetField());
        return new ConditionalConfig(condition, then, otherwise);
    }

    public static LookupConfig lookup(MappingRule rule) {
        Object table = rule.transformConfig().get(TABLE);
        if (!(table instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("LOOKUP rule needs a 'table' object");
        }
        boolean caseInsensitive = Boolean.TRUE.equals(rule.transformConfig().get(CASE_INSENSITIVE));
        Map<String, Object> entries = new LinkedHashMap<>();
        raw.forEach((k, v) -> entries.put(caseInsensitive ? k.toString().toLowerCase() : k.toString(), v));
        return new LookupConfig(entries, rule.transformConfig().get(DEFAULT), caseInsensitive);
    }

    private static MappingRule subRule(Object raw, String parentTarget) {
        if (raw == null) {
            return null;
        }
        MappingRule parsed = raw instanceof MappingRule r ? r : MAPPER.convertValue(raw, MappingRule.class);
        // sub-rules always write to the parent's target
        return new MappingRule(parsed.sourceField(), parentTarget, parsed.transform(), parsed.transformConfig(),
            parsed.dataType(), parsed.required(), parsed.dependsOnPrevious(), parsed.defaultValue(),
            parsed.validation());
    }

    /**
     * Parsed CONDITIONAL configuration. {@code otherwise} may be null, meaning the field is omitted.
     */
    public record ConditionalConfig(Condition condition, MappingRule then, MappingRule otherwise) {
    }

    /**
     * Parsed LOOKUP configuration. Keys are lower-cased when {@code caseInsensitive} is set.
     */
    public record LookupConfig(Map<String, Object> table, Object defaultValue, boolean caseInsensitive) {

        public Object resolve(Object value) {
            if (value == null) {
                return defaultValue;
            }
            String key = caseInsensitive ? value.toString().toLowerCase() : value.toString();
            return table.containsKey(key) ? table.get(key) : defaultValue;
        }
    }
}
