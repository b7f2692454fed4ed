package tech.syncbridge.platform.worker;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of workers running sync jobs and webhook events.
 *
 * <p>Work is queued per group key (see {@link WorkItem#groupKey()}): one item per group is
 * in flight at a time and groups run in parallel up to the worker count. An item id that is
 * already queued or running is not accepted twice, so pollers can resubmit freely.</p>
 *
 * <p>Constructed once at startup and handed to the components that enqueue work.</p>
 */
public class SyncWorkerPool {

    private static final Logger LOG = Logger.getLogger(SyncWorkerPool.class);

    private final ExecutorService executor;
    private final WorkHandler handler;
    private final Map<String, InstanceWorkQueue> queues = new ConcurrentHashMap<>();
    private final Set<String> trackedIds = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown;

    public SyncWorkerPool(int workers, WorkHandler handler) {
        this.handler = handler;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "sync-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        LOG.infof("Sync worker pool started with %d workers", workers);
    }

    /**
     * Queue an item.
     *
     * @return false when the item is already queued or running, or the pool is shut down
     */
    public boolean submit(WorkItem item) {
        if (shutdown) {
            LOG.debugf("Pool is shut down, not accepting [%s]", item.id());
            return false;
        }
        if (!trackedIds.add(item.id())) {
            LOG.tracef("[%s] is already queued or running", item.id());
            return false;
        }
        // Enqueue under the map's per-key lock so cleanupIdleQueues cannot drop the queue in between
        queues.compute(item.groupKey(), (key, queue) -> {
            InstanceWorkQueue target = queue != null ? queue : new InstanceWorkQueue(key, this::execute);
            target.add(item);
            return target;
        });
        return true;
    }

    public boolean isTracked(String itemId) {
        return trackedIds.contains(itemId);
    }

    private void execute(InstanceWorkQueue queue, WorkItem item) {
        try {
            executor.execute(() -> runItem(item, queue));
        } catch (RejectedExecutionException e) {
            trackedIds.remove(item.id());
            throw e;
        }
    }

    private void runItem(WorkItem item, InstanceWorkQueue queue) {
        MDC.put("workItem", item.id());
        try {
            handler.handle(item);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Worker failed on [%s]", item.id());
        } finally {
            MDC.remove("workItem");
            trackedIds.remove(item.id());
            queue.onItemCompleted();
        }
    }

    public int getActiveGroupCount() {
        return (int) queues.values().stream()
            .filter(q -> q.hasPendingItems() || q.hasItemInFlight())
            .count();
    }

    public int getTotalPending() {
        return queues.values().stream()
            .mapToInt(InstanceWorkQueue::getPendingCount)
            .sum();
    }

    /**
     * Drop queues with nothing pending or in flight.
     */
    public void cleanupIdleQueues() {
        for (String key : queues.keySet()) {
            queues.computeIfPresent(key, (k, queue) -> queue.isIdle() ? null : queue);
        }
    }

    /**
     * Stop accepting work and wait for running items. Queued items are left to the pollers
     * of the next start, since their state is durable.
     */
    public void shutdown(long timeoutMillis) {
        shutdown = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                LOG.warnf("Workers still running after %d ms, interrupting", timeoutMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        LOG.info("Sync worker pool stopped");
    }
}
