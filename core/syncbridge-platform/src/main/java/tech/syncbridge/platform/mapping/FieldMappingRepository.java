package tech.syncbridge.platform.mapping;

import tech.syncbridge.transform.mapping.FieldMapping;

import java.util.List;
import java.util.Optional;

public interface FieldMappingRepository {

    void insert(FieldMappingVersion version);

    void updateDefinition(String id, int version, FieldMapping mapping);

    Optional<FieldMappingVersion> findLatest(String id);

    Optional<FieldMappingVersion> findVersion(String id, int version);

    List<FieldMappingVersion> findVersions(String id);

    /**
     * Latest version of the active mapping for an instance, entity type and direction.
     */
    Optional<FieldMappingVersion> findActive(String instanceId, String entityType, MappingDirection direction);

    /**
     * Latest version of every active mapping of an instance.
     */
    List<FieldMappingVersion> findByInstance(String instanceId);

    void deactivate(String id);

    void lock(String id, int version);
}
