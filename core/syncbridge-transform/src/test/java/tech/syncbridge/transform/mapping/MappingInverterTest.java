package tech.syncbridge.transform.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.transform.TransformResult;
import tech.syncbridge.transform.TransformationEngine;
import tech.syncbridge.transform.function.FunctionRegistry;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MappingInverterTest {

    private final TransformationEngine engine = new TransformationEngine(FunctionRegistry.builtins());

    @Test
    @DisplayName("A to B then the inverse B to A reproduces the required source fields")
    void shouldRoundTripRequiredFields() {
        FieldMapping forward = FieldMapping.of("contacts",
            MappingRule.identity("id", "externalId", DataType.STRING).asRequired(),
            MappingRule.identity("properties.email", "email", DataType.STRING).asRequired(),
            MappingRule.identity("properties.firstname", "name.first", DataType.STRING),
            new MappingRule("properties.lifecycle", "stage", TransformType.LOOKUP,
                Map.of("table", Map.of("lead", "LEAD", "customer", "CUSTOMER")), null, true, false, null, null),
            MappingRule.function("properties.email", "domain", "extract_domain"),
            MappingRule.constant("origin", "crm", DataType.STRING));
        Map<String, Object> original = Map.of(
            "id", "101",
            "properties", Map.of("email", "ada@example.com", "firstname", "Ada", "lifecycle", "customer"));

        TransformResult there = engine.transform(original, forward);
        TransformResult back = engine.transform(there.record(), MappingInverter.invert(forward));

        assertThat(back.success()).isTrue();
        assertThat(back.record()).isEqualTo(original);
    }

    @Test
    @DisplayName("Non invertible rules are dropped and lossy lookups are skipped")
    void shouldDropNonInvertibleRules() {
        FieldMapping forward = FieldMapping.of("tickets",
            new MappingRule("state", "status", TransformType.LOOKUP,
                Map.of("table", Map.of("open", "ACTIVE", "reopened", "ACTIVE")), null, false, false, null, null),
            MappingRule.function("title", "title", "uppercase"),
            MappingRule.identity("id", "id", DataType.STRING).asRequired());

        FieldMapping inverse = MappingInverter.invert(forward);

        assertThat(inverse.rules()).extracting(MappingRule::targetField).containsExactly("id");
        assertThat(inverse.requiredTargetFields()).containsExactly("id");
    }
}
