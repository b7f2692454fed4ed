package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rule of a {@link FieldMapping}: reads {@code sourceField}, transforms the value
 * and writes it to {@code targetField}.
 *
 * <p>Reads go against the original source record unless {@code dependsOnPrevious} is set,
 * in which case {@code sourceField} is a path into the target record built by the rules
 * evaluated before this one.</p>
 *
 * @param sourceField       path expression into the source (unused for CONSTANT)
 * @param targetField       path expression into the target, unique within a mapping
 * @param transform         rule kind
 * @param transformConfig   kind specific parameters, see {@link TransformType}
 * @param dataType          type the value is coerced to, {@code null} to keep it as is
 * @param required          missing or invalid value rejects the whole record
 * @param dependsOnPrevious read from the target record under construction
 * @param defaultValue      used when the source value is missing or null
 * @param validation        optional value constraints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MappingRule(
    String sourceField,
    String targetField,
    TransformType transform,
    Map<String, Object> transformConfig,
    DataType dataType,
    boolean required,
    boolean dependsOnPrevious,
    Object defaultValue,
    ValidationRules validation
) {

    public MappingRule {
        if (transform == null) {
            transform = TransformType.IDENTITY;
        }
        transformConfig = transformConfig == null ? Map.of() : transformConfig;
    }

    public static MappingRule identity(String sourceField, String targetField, DataType dataType) {
        return new MappingRule(sourceField, targetField, TransformType.IDENTITY, null, dataType,
            false, false, null, null);
    }

    public static MappingRule function(String sourceField, String targetField, String function) {
        return function(sourceField, targetField, function, Map.of());
    }

    public static MappingRule function(String sourceField, String targetField, String function,
                                       Map<String, Object> args) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(RuleConfigs.FUNCTION, function);
        if (!args.isEmpty()) {
            config.put(RuleConfigs.ARGS, args);
        }
        return new MappingRule(sourceField, targetField, TransformType.FUNCTION, config, DataType.STRING,
            false, false, null, null);
    }

    public static MappingRule constant(String targetField, Object value, DataType dataType) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(RuleConfigs.VALUE, value);
        return new MappingRule(null, targetField, TransformType.CONSTANT, config, dataType,
            false, false, null, null);
    }

    public MappingRule asRequired() {
        return new MappingRule(sourceField, targetField, transform, transformConfig, dataType,
            true, dependsOnPrevious, defaultValue, validation);
    }

    public MappingRule readingPrevious() {
        return new MappingRule(sourceField, targetField, transform, transformConfig, dataType,
            required, true, defaultValue, validation);
    }

    public MappingRule withDefault(Object value) {
        return new MappingRule(sourceField, targetField, transform, transformConfig, dataType,
            required, dependsOnPrevious, value, validation);
    }

    public MappingRule withValidation(ValidationRules rules) {
        return new MappingRule(sourceField, targetField, transform, transformConfig, dataType,
            required, dependsOnPrevious, defaultValue, rules);
    }
}
