package tech.syncbridge.transform.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Ordered rule list converting one record schema into another.
 *
 * @param name                 human readable name
 * @param rules                rules, evaluated in list order
 * @param requiredTargetFields target paths that must be present for a record to be accepted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldMapping(
    String name,
    List<MappingRule> rules,
    List<String> requiredTargetFields
) {

    public FieldMapping {
        rules = rules == null ? List.of() : List.copyOf(rules);
        requiredTargetFields = requiredTargetFields == null ? List.of() : List.copyOf(requiredTargetFields);
    }

    public static FieldMapping of(String name, MappingRule... rules) {
        return new FieldMapping(name, List.of(rules), List.of());
    }

    public FieldMapping requiring(String... targetFields) {
        return new FieldMapping(name, rules, List.of(targetFields));
    }
}
