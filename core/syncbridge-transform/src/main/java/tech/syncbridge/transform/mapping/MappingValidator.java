package tech.syncbridge.transform.mapping;

import tech.syncbridge.transform.function.FunctionRegistry;
import tech.syncbridge.transform.path.FieldPath;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Write time validation of {@link FieldMapping}s.
 *
 * <p>Checks performed:</p>
 * <ul>
 *   <li>at least one rule</li>
 *   <li>target fields are valid paths and unique within the mapping</li>
 *   <li>source fields are valid paths (not needed for CONSTANT)</li>
 *   <li>FUNCTION names exist in the registry</li>
 *   <li>CONSTANT, CONDITIONAL and LOOKUP configs are well formed, recursively for sub-rules</li>
 *   <li>validation patterns compile</li>
 *   <li>{@code dependsOnPrevious} rules read a field an earlier rule writes</li>
 *   <li>every required target field is written by some rule</li>
 * </ul>
 */
public class MappingValidator {

    private final FunctionRegistry functions;

    public MappingValidator(FunctionRegistry functions) {
        this.functions = functions;
    }

    public List<MappingViolation> validate(FieldMapping mapping) {
        List<MappingViolation> violations = new ArrayList<>();
        if (mapping.rules().isEmpty()) {
            violations.add(new MappingViolation("rules", MappingViolation.EMPTY_MAPPING,
                "mapping must contain at least one rule"));
            return violations;
        }

        Set<String> written = new HashSet<>();
        for (int i = 0; i < mapping.rules().size(); i++) {
            MappingRule rule = mapping.rules().get(i);
            String location = "rules[" + i + "]";

            FieldPath target = path(rule.targetField(), location + ".targetField", violations);
            if (target != null && !written.add(target.expression())) {
                violations.add(new MappingViolation(location + ".targetField", MappingViolation.DUPLICATE_TARGET_FIELD,
                    "target field '" + rule.targetField() + "' is written by more than one rule"));
            }

            if (rule.dependsOnPrevious() && rule.sourceField() != null
                && written.stream().noneMatch(w -> w.equals(rule.sourceField()) || rule.sourceField().startsWith(w + "."))) {
                violations.add(new MappingViolation(location + ".sourceField", MappingViolation.DEPENDENCY_NOT_SATISFIED,
                    "'" + rule.sourceField() + "' is not written by an earlier rule"));
            }

            validateRule(rule, location, violations, 0);
        }

        for (String required : mapping.requiredTargetFields()) {
            if (!written.contains(required)) {
                violations.add(new MappingViolation("requiredTargetFields", MappingViolation.UNSATISFIABLE_REQUIRED_FIELD,
                    "no rule writes required target field '" + required + "'"));
            }
        }
        return violations;
    }

    /**
     * @throws MappingValidationException if the mapping has any violation
     */
    public void validateOrThrow(FieldMapping mapping) {
        List<MappingViolation> violations = validate(mapping);
        if (!violations.isEmpty()) {
            throw new MappingValidationException(violations);
        }
    }

    private void validateRule(MappingRule rule, String location, List<MappingViolation> violations, int depth) {
        if (rule.transform() != TransformType.CONSTANT && rule.transform() != TransformType.CONDITIONAL) {
            if (rule.sourceField() == null || rule.sourceField().isBlank()) {
                violations.add(new MappingViolation(location + ".sourceField", MappingViolation.MISSING_SOURCE_FIELD,
                    rule.transform() + " rule needs a source field"));
            } else {
                path(rule.sourceField(), location + ".sourceField", violations);
            }
        }

        try {
            switch (rule.transform()) {
                case FUNCTION -> {
                    String name = RuleConfigs.functionName(rule);
                    RuleConfigs.functionArgs(rule);
                    if (!functions.contains(name)) {
                        violations.add(new MappingViolation(location + ".transformConfig.function",
                            MappingViolation.UNKNOWN_FUNCTION, "unknown function '" + name + "'"));
                    }
                }
                case CONSTANT -> {
                    if (!RuleConfigs.hasConstant(rule)) {
                        violations.add(new MappingViolation(location + ".transformConfig", MappingViolation.INVALID_CONFIG,
                            "CONSTANT rule needs a 'value'"));
                    }
                }
                case CONDITIONAL -> {
                    if (depth >= 3) {
                        violations.add(new MappingViolation(location, MappingViolation.INVALID_CONFIG,
                            "conditional rules nest at most 3 levels"));
                        return;
                    }
                    RuleConfigs.ConditionalConfig config = RuleConfigs.conditional(rule);
                    path(config.condition().field(), location + ".transformConfig.condition.field", violations);
                    if (!config.condition().operator().isUnary() && config.condition().value() == null) {
                        violations.add(new MappingViolation(location + ".transformConfig.condition", MappingViolation.INVALID_CONFIG,
                            "operator '" + config.condition().operator().getValue() + "' needs a value"));
                    }
                    if (config.condition().operator() == ConditionOperator.MATCHES && config.condition().value() != null) {
                        compile(config.condition().value().toString(), location + ".transformConfig.condition.value", violations);
                    }
                    validateRule(config.then(), location + ".then", violations, depth + 1);
                    if (config.otherwise() != null) {
                        validateRule(config.otherwise(), location + ".else", violations, depth + 1);
                    }
                }
                case LOOKUP -> RuleConfigs.lookup(rule);
                case IDENTITY -> {
                    // nothing beyond the source path
                }
            }
        } catch (IllegalArgumentException e) {
            violations.add(new MappingViolation(location + ".transformConfig", MappingViolation.INVALID_CONFIG, e.getMessage()));
        }

        if (rule.validation() != null && rule.validation().pattern() != null) {
            compile(rule.validation().pattern(), location + ".validation.pattern", violations);
        }
    }

    private FieldPath path(String expression, String location, List<MappingViolation> violations) {
        try {
            return FieldPath.parse(expression);
        } catch (IllegalArgumentException e) {
            violations.add(new MappingViolation(location, MappingViolation.INVALID_PATH, e.getMessage()));
            return null;
        }
    }

    private void compile(String regex, String location, List<MappingViolation> violations) {
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            violations.add(new MappingViolation(location, MappingViolation.INVALID_PATTERN, e.getDescription()));
        }
    }
}
