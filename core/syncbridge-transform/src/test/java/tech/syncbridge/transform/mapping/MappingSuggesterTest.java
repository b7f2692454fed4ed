package tech.syncbridge.transform.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MappingSuggesterTest {

    @Test
    void shouldPairFieldsByNameSimilarity() {
        FieldMapping draft = MappingSuggester.suggest("draft",
            List.of("properties.firstname", "properties.email", "properties.phone_number", "properties.hs_object_id"),
            List.of("first_name", "emailAddress", "phone", "favouriteColour"));

        assertThat(draft.rules())
            .extracting(MappingRule::sourceField, MappingRule::targetField, MappingRule::transform)
            .containsExactly(
                org.assertj.core.groups.Tuple.tuple("properties.firstname", "first_name", TransformType.IDENTITY),
                org.assertj.core.groups.Tuple.tuple("properties.email", "emailAddress", TransformType.FUNCTION),
                org.assertj.core.groups.Tuple.tuple("properties.phone_number", "phone", TransformType.FUNCTION));
    }

    @Test
    void shouldScoreExactContainedAndUnrelatedNames() {
        assertThat(MappingSuggester.similarity("First_Name", "firstName")).isEqualTo(1.0);
        assertThat(MappingSuggester.similarity("email", "workEmail")).isEqualTo(0.8);
        assertThat(MappingSuggester.similarity("colour", "zip")).isZero();
    }
}
