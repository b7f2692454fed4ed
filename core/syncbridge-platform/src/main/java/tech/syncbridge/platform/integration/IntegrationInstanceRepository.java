package tech.syncbridge.platform.integration;

import java.util.List;
import java.util.Optional;

public interface IntegrationInstanceRepository {

    void insert(IntegrationInstance instance);

    void update(IntegrationInstance instance);

    Optional<IntegrationInstance> findById(String id);

    List<IntegrationInstance> findByTenant(String tenantId);

    /**
     * ACTIVE instances that carry a schedule.
     */
    List<IntegrationInstance> findScheduled();
}
