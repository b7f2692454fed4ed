package tech.syncbridge.platform.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SyncWorkerPoolTest {

    private SyncWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(1000);
        }
    }

    @Test
    @DisplayName("Items of one instance run one at a time in submission order")
    void submit_shouldSerializeItemsOfOneInstance() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<String> order = new CopyOnWriteArrayList<>();
        pool = new SyncWorkerPool(4, item -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            order.add(item.id());
            sleep(20);
            inFlight.decrementAndGet();
        });

        for (int i = 0; i < 5; i++) {
            pool.submit(new WorkItem.SyncJobWork("job-" + i, "int_a"));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> order.size() == 5 && pool.getActiveGroupCount() == 0);
        assertThat(order).containsExactly("job-0", "job-1", "job-2", "job-3", "job-4");
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Idle-queue cleanup racing with submissions never runs two items of one instance at once")
    void submit_shouldKeepSerialization_whileIdleQueuesAreCleanedUp() throws Exception {
        int items = 300;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<String> order = new CopyOnWriteArrayList<>();
        pool = new SyncWorkerPool(4, item -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            order.add(item.id());
            inFlight.decrementAndGet();
        });

        AtomicBoolean submitting = new AtomicBoolean(true);
        Thread cleaner = new Thread(() -> {
            while (submitting.get()) {
                pool.cleanupIdleQueues();
            }
        }, "queue-cleaner");
        cleaner.start();
        try {
            for (int i = 0; i < items; i++) {
                pool.submit(new WorkItem.WebhookWork("evt-" + i, "int_a"));
                if (i % 10 == 0) {
                    sleep(1);
                }
            }
            await().atMost(Duration.ofSeconds(10)).until(() -> order.size() == items);
        } finally {
            submitting.set(false);
            cleaner.join(5000);
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(order).containsExactlyElementsOf(
            IntStream.range(0, items).mapToObj(i -> "evt-" + i).toList());
    }

    @Test
    @DisplayName("Different instances run in parallel")
    void submit_shouldRunInstancesInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        pool = new SyncWorkerPool(2, item -> {
            bothStarted.countDown();
            awaitQuietly(release);
        });

        pool.submit(new WorkItem.SyncJobWork("job-a", "int_a"));
        pool.submit(new WorkItem.SyncJobWork("job-b", "int_b"));

        assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    @DisplayName("An item already queued or running is not accepted twice")
    void submit_shouldRejectDuplicateIds() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        pool = new SyncWorkerPool(1, item -> {
            runs.incrementAndGet();
            awaitQuietly(release);
        });

        assertThat(pool.submit(new WorkItem.SyncJobWork("job-1", "int_a"))).isTrue();
        assertThat(pool.submit(new WorkItem.SyncJobWork("job-1", "int_a"))).isFalse();
        assertThat(pool.isTracked("job-1")).isTrue();

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> !pool.isTracked("job-1"));
        assertThat(runs.get()).isEqualTo(1);
        assertThat(pool.submit(new WorkItem.SyncJobWork("job-1", "int_a"))).isTrue();
    }

    @Test
    @DisplayName("A failing item does not stop the queue behind it")
    void submit_shouldContinue_afterHandlerFailure() {
        List<String> done = new CopyOnWriteArrayList<>();
        pool = new SyncWorkerPool(1, item -> {
            if (item.id().equals("bad")) {
                throw new IllegalStateException("boom");
            }
            done.add(item.id());
        });

        pool.submit(new WorkItem.WebhookWork("bad", "int_a"));
        pool.submit(new WorkItem.WebhookWork("good", "int_a"));

        await().atMost(Duration.ofSeconds(5)).until(() -> done.contains("good"));
        pool.cleanupIdleQueues();
        assertThat(pool.getTotalPending()).isZero();
    }

    @Test
    @DisplayName("Submissions after shutdown are refused")
    void submit_shouldRefuse_afterShutdown() {
        pool = new SyncWorkerPool(1, item -> { });
        pool.shutdown(1000);

        assertThat(pool.submit(new WorkItem.SyncJobWork("job-1", "int_a"))).isFalse();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
