package tech.syncbridge.platform.mapping;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.syncbridge.platform.integration.IntegrationService;
import tech.syncbridge.platform.shared.EntityType;
import tech.syncbridge.platform.shared.TsidGenerator;
import tech.syncbridge.platform.store.SyncStore;
import tech.syncbridge.transform.TransformResult;
import tech.syncbridge.transform.TransformationEngine;
import tech.syncbridge.transform.mapping.FieldMapping;
import tech.syncbridge.transform.mapping.MappingSuggester;
import tech.syncbridge.transform.mapping.MappingValidator;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned field mapping configuration. Every write is validated, so a mapping that
 * reaches a sync job never carries configuration errors.
 */
@ApplicationScoped
public class FieldMappingService {

    private static final Logger LOG = Logger.getLogger(FieldMappingService.class);

    private final SyncStore store;
    private final FieldMappingRepository repository;
    private final MappingValidator validator;
    private final TransformationEngine engine;
    private final IntegrationService integrations;

    @Inject
    public FieldMappingService(SyncStore store, FieldMappingRepository repository, MappingValidator validator,
                               TransformationEngine engine, IntegrationService integrations) {
        this.store = store;
        this.repository = repository;
        this.validator = validator;
        this.engine = engine;
        this.integrations = integrations;
    }

    /**
     * @throws tech.syncbridge.transform.mapping.MappingValidationException if the mapping is invalid
     * @throws IllegalStateException if an active mapping already exists for the same entity type and direction
     */
    public FieldMappingVersion create(String instanceId, String entityType, MappingDirection direction, FieldMapping mapping) {
        integrations.get(instanceId);
        validator.validateOrThrow(mapping);

        return store.inTransaction(conn -> {
            if (repository.findActive(instanceId, entityType, direction).isPresent()) {
                throw new IllegalStateException("An active " + direction + " mapping for entity type "
                    + entityType + " already exists on instance " + instanceId);
            }
            FieldMappingVersion version = new FieldMappingVersion();
            version.id = TsidGenerator.generate(EntityType.FIELD_MAPPING);
            version.version = 1;
            version.instanceId = instanceId;
            version.entityType = entityType;
            version.direction = direction;
            version.mapping = mapping;
            version.active = true;
            version.createdAt = Instant.now();
            repository.insert(version);
            LOG.infof("Field mapping [%s] created for instance [%s] %s %s", version.id, instanceId, direction, entityType);
            return version;
        });
    }

    /**
     * Update a mapping. A locked latest version is left untouched and a new version is created.
     */
    public FieldMappingVersion update(String id, FieldMapping mapping) {
        validator.validateOrThrow(mapping);

        return store.inTransaction(conn -> {
            FieldMappingVersion latest = get(id);
            if (!latest.active) {
                throw new NotFoundException("Field mapping not found: " + id);
            }
            if (!latest.locked) {
                repository.updateDefinition(id, latest.version, mapping);
                latest.mapping = mapping;
                return latest;
            }
            FieldMappingVersion next = new FieldMappingVersion();
            next.id = id;
            next.version = latest.version + 1;
            next.instanceId = latest.instanceId;
            next.entityType = latest.entityType;
            next.direction = latest.direction;
            next.mapping = mapping;
            next.active = true;
            next.createdAt = Instant.now();
            repository.insert(next);
            LOG.infof("Field mapping [%s] version %d is locked, created version %d", id, latest.version, next.version);
            return next;
        });
    }

    public void delete(String id) {
        get(id);
        repository.deactivate(id);
        LOG.infof("Field mapping [%s] deactivated", id);
    }

    public FieldMappingVersion get(String id) {
        return repository.findLatest(id)
            .orElseThrow(() -> new NotFoundException("Field mapping not found: " + id));
    }

    public List<FieldMappingVersion> versions(String id) {
        return repository.findVersions(id);
    }

    public Optional<FieldMappingVersion> findVersion(String id, int version) {
        return repository.findVersion(id, version);
    }

    public List<FieldMappingVersion> list(String instanceId) {
        return repository.findByInstance(instanceId);
    }

    public Optional<FieldMappingVersion> activeFor(String instanceId, String entityType, MappingDirection direction) {
        return repository.findActive(instanceId, entityType, direction);
    }

    /**
     * Lock the mapping versions a completed job used, keyed by mapping id.
     */
    public void lockVersions(Map<String, Integer> versions) {
        versions.forEach(repository::lock);
    }

    /**
     * Transform a sample record with the latest version, persisting nothing.
     */
    public TransformResult preview(String id, Map<String, Object> sample) {
        return engine.transform(sample, get(id).mapping);
    }

    public FieldMapping suggest(String name, List<String> sourceFields, List<String> targetFields) {
        return MappingSuggester.suggest(name, sourceFields, targetFields);
    }
}
