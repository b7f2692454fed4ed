package tech.syncbridge.transform;

import org.jboss.logging.Logger;
import tech.syncbridge.transform.coerce.TypeCoercer;
import tech.syncbridge.transform.coerce.TypeCoercionException;
import tech.syncbridge.transform.function.FunctionException;
import tech.syncbridge.transform.function.FunctionRegistry;
import tech.syncbridge.transform.mapping.FieldMapping;
import tech.syncbridge.transform.mapping.MappingRule;
import tech.syncbridge.transform.mapping.RuleConfigs;
import tech.syncbridge.transform.path.FieldPath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interpreter for {@link FieldMapping} rule lists.
 *
 * <h2>Evaluation</h2>
 * <p>Rules run in list order. Each rule reads from the original source record, or from the
 * target record built so far when it is marked {@code dependsOnPrevious}. The value then goes
 * through the rule's transform, type coercion and validation before it is written.</p>
 *
 * <h2>Failures</h2>
 * <pre>
 * missing value, required rule     -> record rejected (REQUIRED_FIELD_MISSING)
 * missing value, optional rule     -> field omitted
 * coercion failure                 -> field omitted, warning (TYPE_COERCION_FAILED)
 * function or validation failure   -> record rejected if required, otherwise warning
 * required target field absent     -> record rejected (TARGET_SCHEMA_VIOLATION)
 * </pre>
 *
 * <p>The engine is stateless and thread safe. Mappings are expected to have passed
 * {@link tech.syncbridge.transform.mapping.MappingValidator} already.</p>
 */
public class TransformationEngine {

    private static final Logger LOG = Logger.getLogger(TransformationEngine.class);

    private final FunctionRegistry functions;

    public TransformationEngine(FunctionRegistry functions) {
        this.functions = functions;
    }

    public TransformResult transform(Map<String, Object> record, FieldMapping mapping) {
        Map<String, Object> source = record == null ? Map.of() : record;
        Map<String, Object> output = new LinkedHashMap<>();
        List<TransformationError> errors = new ArrayList<>();
        List<TransformationError> warnings = new ArrayList<>();

        for (MappingRule rule : mapping.rules()) {
            try {
                Object value = evaluate(rule, source, output);
                if (value != null) {
                    FieldPath.parse(rule.targetField()).set(output, value);
                }
            } catch (RuleFailure failure) {
                TransformationError error = new TransformationError(rule.targetField(), failure.reason, failure.getMessage());
                if (isFatal(rule, failure.reason)) {
                    errors.add(error);
                } else {
                    warnings.add(error);
                }
            }
        }

        for (String required : mapping.requiredTargetFields()) {
            if (!FieldPath.parse(required).isPresent(output)) {
                errors.add(new TransformationError(required, ErrorReason.TARGET_SCHEMA_VIOLATION,
                    "required target field is missing"));
            }
        }

        if (!errors.isEmpty()) {
            LOG.debugf("Record rejected by mapping [%s]: %s", mapping.name(), errors);
            return TransformResult.rejected(errors, warnings);
        }
        return TransformResult.success(output, warnings);
    }

    private boolean isFatal(MappingRule rule, ErrorReason reason) {
        return switch (reason) {
            case REQUIRED_FIELD_MISSING -> true;
            case TYPE_COERCION_FAILED -> false;
            default -> rule.required();
        };
    }

    private Object evaluate(MappingRule rule, Map<String, Object> source, Map<String, Object> output)
            throws RuleFailure {
        Object value = switch (rule.transform()) {
            case CONSTANT -> RuleConfigs.constant(rule);
            case CONDITIONAL -> evaluateConditional(rule, source, output);
            case IDENTITY, FUNCTION, LOOKUP -> read(rule, source, output);
        };

        if (value == null) {
            if (rule.required()) {
                throw new RuleFailure(ErrorReason.REQUIRED_FIELD_MISSING,
                    "source field '" + rule.sourceField() + "' is missing");
            }
            return null;
        }

        try {
            value = TypeCoercer.coerce(value, rule.dataType());
        } catch (TypeCoercionException e) {
            throw new RuleFailure(ErrorReason.TYPE_COERCION_FAILED, e.getMessage());
        }

        Optional<String> violation = ValueValidator.check(value, rule.validation());
        if (violation.isPresent()) {
            throw new RuleFailure(ErrorReason.VALIDATION_FAILED, violation.get());
        }
        return copy(value);
    }

    private Object read(MappingRule rule, Map<String, Object> source, Map<String, Object> output)
            throws RuleFailure {
        Map<String, Object> input = rule.dependsOnPrevious() ? output : source;
        Object value = FieldPath.read(input, rule.sourceField());
        if (value == null) {
            value = rule.defaultValue();
        }
        if (value == null) {
            return null;
        }
        return switch (rule.transform()) {
            case FUNCTION -> applyFunction(rule, value);
            case LOOKUP -> RuleConfigs.lookup(rule).resolve(value);
            default -> value;
        };
    }

    private Object applyFunction(MappingRule rule, Object value) throws RuleFailure {
        String name = RuleConfigs.functionName(rule);
        try {
            return functions.apply(name, value, RuleConfigs.functionArgs(rule));
        } catch (FunctionException e) {
            throw new RuleFailure(ErrorReason.FUNCTION_FAILED, e.getMessage());
        }
    }

    private Object evaluateConditional(MappingRule rule, Map<String, Object> source, Map<String, Object> output)
            throws RuleFailure {
        RuleConfigs.ConditionalConfig config = RuleConfigs.conditional(rule);
        MappingRule chosen = Conditions.evaluate(config.condition(), source) ? config.then() : config.otherwise();
        if (chosen == null) {
            return rule.defaultValue();
        }
        Object value = evaluate(chosen, source, output);
        return value != null ? value : rule.defaultValue();
    }

    // Output never shares mutable containers with the source
    private static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copy(item));
            }
            return copy;
        }
        return value;
    }

    private static final class RuleFailure extends Exception {

        private final ErrorReason reason;

        RuleFailure(ErrorReason reason, String message) {
            super(message, null, false, false);
            this.reason = reason;
        }
    }
}
