package tech.syncbridge.platform.mapping;

import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.PlatformFixture;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.transform.TransformResult;
import tech.syncbridge.transform.mapping.DataType;
import tech.syncbridge.transform.mapping.FieldMapping;
import tech.syncbridge.transform.mapping.MappingRule;
import tech.syncbridge.transform.mapping.MappingValidationException;
import tech.syncbridge.transform.mapping.MappingViolation;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldMappingServiceTest {

    private static final FieldMapping V1 = FieldMapping.of("contacts-in",
        MappingRule.identity("id", "id", DataType.STRING));
    private static final FieldMapping V2 = FieldMapping.of("contacts-in",
        MappingRule.identity("id", "id", DataType.STRING),
        MappingRule.function("properties.email", "email", "normalize_email"));

    private PlatformFixture f;
    private IntegrationInstance instance;

    @BeforeEach
    void setUp() {
        f = new PlatformFixture();
        instance = f.activeInstance(null);
    }

    // ==================== Create ====================

    @Test
    @DisplayName("Create stores version 1 as the active mapping")
    void create_shouldStoreFirstVersion() {
        FieldMappingVersion created = f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1);

        assertThat(created.version).isEqualTo(1);
        assertThat(f.mappings.activeFor(instance.id, "contact", MappingDirection.INBOUND))
            .hasValueSatisfying(active -> assertThat(active.id).isEqualTo(created.id));
        assertThat(f.mappings.activeFor(instance.id, "contact", MappingDirection.OUTBOUND)).isEmpty();
    }

    @Test
    @DisplayName("Invalid mappings are rejected with every violation")
    void create_shouldThrow_whenMappingInvalid() {
        FieldMapping invalid = FieldMapping.of("broken",
            MappingRule.function("name", "name", "no_such_function"),
            MappingRule.identity("other", "name", DataType.STRING));

        assertThatThrownBy(() -> f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, invalid))
            .isInstanceOfSatisfying(MappingValidationException.class, e ->
                assertThat(e.getViolations()).extracting(MappingViolation::code)
                    .contains(MappingViolation.UNKNOWN_FUNCTION, MappingViolation.DUPLICATE_TARGET_FIELD));
        assertThat(f.mappings.list(instance.id)).isEmpty();
    }

    @Test
    @DisplayName("A second active mapping for the same entity type and direction is refused")
    void create_shouldThrow_whenActiveMappingExists() {
        f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1);

        assertThatThrownBy(() -> f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1))
            .isInstanceOf(IllegalStateException.class);
    }

    // ==================== Versioning ====================

    @Test
    @DisplayName("Updating an unlocked version edits it in place")
    void update_shouldEditInPlace_whenUnlocked() {
        FieldMappingVersion created = f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1);

        FieldMappingVersion updated = f.mappings.update(created.id, V2);

        assertThat(updated.version).isEqualTo(1);
        assertThat(f.mappings.versions(created.id)).hasSize(1);
        assertThat(f.mappings.get(created.id).mapping.rules()).hasSize(2);
    }

    @Test
    @DisplayName("Updating a version a job used creates a new version and keeps the old one intact")
    void update_shouldCreateNewVersion_whenLocked() {
        FieldMappingVersion created = f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1);
        f.mappings.lockVersions(Map.of(created.id, 1));

        FieldMappingVersion updated = f.mappings.update(created.id, V2);

        assertThat(updated.version).isEqualTo(2);
        assertThat(f.mappings.versions(created.id)).hasSize(2);
        assertThat(f.mappings.findVersion(created.id, 1)).hasValueSatisfying(v1 -> {
            assertThat(v1.locked).isTrue();
            assertThat(v1.mapping.rules()).hasSize(1);
        });
        assertThat(f.mappings.activeFor(instance.id, "contact", MappingDirection.INBOUND))
            .hasValueSatisfying(active -> assertThat(active.version).isEqualTo(2));
    }

    @Test
    @DisplayName("Deleted mappings are no longer active and cannot be updated")
    void delete_shouldDeactivate() {
        FieldMappingVersion created = f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V1);

        f.mappings.delete(created.id);

        assertThat(f.mappings.activeFor(instance.id, "contact", MappingDirection.INBOUND)).isEmpty();
        assertThatThrownBy(() -> f.mappings.update(created.id, V2)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> f.mappings.get("fm_missing")).isInstanceOf(NotFoundException.class);
    }

    // ==================== Preview / Suggest ====================

    @Test
    @DisplayName("Preview transforms a sample without persisting anything")
    void preview_shouldTransformSample() {
        FieldMappingVersion created = f.mappings.create(instance.id, "contact", MappingDirection.INBOUND, V2);

        TransformResult result = f.mappings.preview(created.id,
            Map.of("id", "c1", "properties", Map.of("email", "  Jane@Example.COM ")));

        assertThat(result.success()).isTrue();
        assertThat(result.record()).containsEntry("id", "c1").containsEntry("email", "jane@example.com");
    }

    @Test
    @DisplayName("Suggest pairs fields with matching names")
    void suggest_shouldPairMatchingFields() {
        FieldMapping suggested = f.mappings.suggest("auto", List.of("email", "first_name"), List.of("Email", "firstName"));

        assertThat(suggested.rules()).extracting(MappingRule::targetField).contains("Email", "firstName");
    }
}
