package tech.syncbridge.transform.function;

import java.util.Map;

/**
 * A named pure transformation usable from FUNCTION rules.
 * Implementations must be deterministic and free of side effects.
 */
@FunctionalInterface
public interface TransformFunction {

    /**
     * @param value source value, never null
     * @param args  rule arguments, never null
     * @return transformed value, or null to omit the field
     */
    Object apply(Object value, Map<String, Object> args);
}
