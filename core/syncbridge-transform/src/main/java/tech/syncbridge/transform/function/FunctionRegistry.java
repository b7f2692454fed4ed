package tech.syncbridge.transform.function;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fixed set of functions available to FUNCTION rules.
 *
 * <p>The registry is closed once built. Mapping validation checks every
 * function name against it, so an unknown name never reaches the engine.</p>
 */
public final class FunctionRegistry {

    private final Map<String, TransformFunction> functions;

    private FunctionRegistry(Map<String, TransformFunction> functions) {
        this.functions = Collections.unmodifiableMap(new TreeMap<>(functions));
    }

    /**
     * Registry holding the built-in functions.
     */
    public static FunctionRegistry builtins() {
        return builder().withBuiltins().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * Apply a registered function.
     *
     * @throws IllegalArgumentException if the function is not registered
     * @throws FunctionException if the function rejects the value
     */
    public Object apply(String name, Object value, Map<String, Object> args) {
        TransformFunction function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown function: " + name);
        }
        try {
            return function.apply(value, args == null ? Map.of() : args);
        } catch (FunctionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FunctionException("Function '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    public static final class Builder {

        private final Map<String, TransformFunction> functions = new TreeMap<>();

        public Builder withBuiltins() {
            register("normalize_email", (v, a) -> StringFunctions.normalizeEmail(v.toString()));
            register("normalize_phone", (v, a) -> StringFunctions.normalizePhone(v.toString()));
            register("uppercase", (v, a) -> v.toString().toUpperCase());
            register("lowercase", (v, a) -> v.toString().toLowerCase());
            register("trim", (v, a) -> v.toString().trim());
            register("remove_whitespace", (v, a) -> v.toString().replaceAll("\\s+", ""));
            register("snake_case", (v, a) -> StringFunctions.snakeCase(v.toString()));
            register("camel_case", (v, a) -> StringFunctions.camelCase(v.toString()));
            register("extract_domain", (v, a) -> StringFunctions.extractDomain(v.toString()));
            register("first_name", (v, a) -> StringFunctions.firstName(v.toString()));
            register("last_name", (v, a) -> StringFunctions.lastName(v.toString()));
            register("format_currency", StringFunctions::formatCurrency);
            register("truncate", StringFunctions::truncate);
            register("sha256", (v, a) -> StringFunctions.sha256(v.toString()));
            register("split", StringFunctions::split);
            register("join", StringFunctions::join);
            return this;
        }

        public Builder register(String name, TransformFunction function) {
            if (functions.putIfAbsent(name, function) != null) {
                throw new IllegalStateException("Function already registered: " + name);
            }
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(functions);
        }
    }
}
