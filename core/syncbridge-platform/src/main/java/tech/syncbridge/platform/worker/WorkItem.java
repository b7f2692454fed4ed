package tech.syncbridge.platform.worker;

/**
 * Unit of work for the worker pool. Items with the same group key run one at a time
 * in submission order; different groups run in parallel.
 */
public sealed interface WorkItem permits WorkItem.SyncJobWork, WorkItem.WebhookWork {

    String id();

    String groupKey();

    /**
     * Run a sync job. Jobs of one instance are serialized.
     */
    record SyncJobWork(String id, String instanceId) implements WorkItem {
        @Override
        public String groupKey() {
            return "sync:" + instanceId;
        }
    }

    /**
     * Process a webhook event. Events of one instance run in receipt order.
     */
    record WebhookWork(String id, String instanceId) implements WorkItem {
        @Override
        public String groupKey() {
            return "webhook:" + instanceId;
        }
    }
}
