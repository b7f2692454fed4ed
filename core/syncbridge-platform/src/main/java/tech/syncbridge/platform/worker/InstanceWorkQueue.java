package tech.syncbridge.platform.worker;

import org.jboss.logging.Logger;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * In-memory FIFO for one group key. Ensures only one item of the group is in flight.
 */
class InstanceWorkQueue {

    private static final Logger LOG = Logger.getLogger(InstanceWorkQueue.class);

    private final String groupKey;
    private final Queue<WorkItem> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicInteger pendingCount = new AtomicInteger(0);
    private final BiConsumer<InstanceWorkQueue, WorkItem> dispatchFunction;

    InstanceWorkQueue(String groupKey, BiConsumer<InstanceWorkQueue, WorkItem> dispatchFunction) {
        this.groupKey = groupKey;
        this.dispatchFunction = dispatchFunction;
    }

    void add(WorkItem item) {
        pending.add(item);
        pendingCount.incrementAndGet();
        tryDispatchNext();
    }

    /**
     * Called by the worker when the in-flight item finished, successfully or not.
     */
    void onItemCompleted() {
        inFlight.set(false);
        tryDispatchNext();
    }

    private void tryDispatchNext() {
        // Re-check after releasing the flag: an item added while the flag was held would otherwise wait forever
        while (!pending.isEmpty() && inFlight.compareAndSet(false, true)) {
            WorkItem next = pending.poll();
            if (next == null) {
                inFlight.set(false);
                continue;
            }
            pendingCount.decrementAndGet();
            LOG.debugf("Dispatching [%s] for group [%s]", next.id(), groupKey);
            try {
                dispatchFunction.accept(this, next);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to dispatch [%s] for group [%s]", next.id(), groupKey);
                inFlight.set(false);
                continue;
            }
            return;
        }
    }

    boolean isIdle() {
        return !hasItemInFlight() && !hasPendingItems();
    }

    boolean hasPendingItems() {
        return pendingCount.get() > 0;
    }

    int getPendingCount() {
        return pendingCount.get();
    }

    boolean hasItemInFlight() {
        return inFlight.get();
    }

    String getGroupKey() {
        return groupKey;
    }
}
