package tech.syncbridge.transform.mapping;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the B to A mapping of an A to B mapping where that is possible.
 *
 * <p>IDENTITY rules invert by swapping source and target. LOOKUP rules invert when their
 * table is one to one. FUNCTION, CONSTANT and CONDITIONAL rules lose information and are
 * dropped. Required source fields of the forward mapping become required target fields of
 * the inverse.</p>
 */
public final class MappingInverter {

    private MappingInverter() {
    }

    public static FieldMapping invert(FieldMapping mapping) {
        List<MappingRule> rules = new ArrayList<>();
        List<String> required = new ArrayList<>();
        Set<String> targets = new HashSet<>();

        for (MappingRule rule : mapping.rules()) {
            if (rule.dependsOnPrevious() || rule.sourceField() == null) {
                continue;
            }
            Optional<MappingRule> inverse = switch (rule.transform()) {
                case IDENTITY -> Optional.of(new MappingRule(rule.targetField(), rule.sourceField(),
                    TransformType.IDENTITY, null, rule.dataType(), rule.required(), false, null, null));
                case LOOKUP -> invertLookup(rule);
                default -> Optional.empty();
            };
            // fan-out rules would write the same source twice
            if (inverse.isPresent() && targets.add(inverse.get().targetField())) {
                rules.add(inverse.get());
                if (rule.required()) {
                    required.add(rule.sourceField());
                }
            }
        }
        String name = mapping.name() == null ? null : mapping.name() + " (inverse)";
        return new FieldMapping(name, rules, required);
    }

    private static Optional<MappingRule> invertLookup(MappingRule rule) {
        RuleConfigs.LookupConfig lookup = RuleConfigs.lookup(rule);
        Map<String, Object> inverted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : lookup.table().entrySet()) {
            String key = String.valueOf(entry.getValue());
            if (inverted.put(key, entry.getKey()) != null) {
                return Optional.empty();
            }
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(RuleConfigs.TABLE, inverted);
        return Optional.of(new MappingRule(rule.targetField(), rule.sourceField(), TransformType.LOOKUP, config,
            null, rule.required(), false, null, null));
    }
}
