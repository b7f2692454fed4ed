package tech.syncbridge.platform.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.syncbridge.platform.sync.JobResult;
import tech.syncbridge.platform.sync.SyncJobService;
import tech.syncbridge.platform.sync.SyncOrchestrator;
import tech.syncbridge.platform.webhook.WebhookProcessor;

/**
 * Routes work items to the component that owns them.
 */
@ApplicationScoped
public class WorkDispatcher implements WorkHandler {

    @Inject
    SyncOrchestrator orchestrator;

    @Inject
    SyncJobService jobService;

    @Inject
    WebhookProcessor webhookProcessor;

    @Override
    public void handle(WorkItem item) {
        if (item instanceof WorkItem.SyncJobWork work) {
            JobResult result = orchestrator.run(work.id());
            if (result.isTerminal()) {
                jobService.dispatchNext(work.instanceId());
            }
        } else if (item instanceof WorkItem.WebhookWork work) {
            webhookProcessor.process(work.id());
        }
    }
}
