package tech.syncbridge.platform.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Builds the one worker pool of the process and hands it to the components that enqueue work.
 */
@ApplicationScoped
public class WorkerPoolProducer {

    @Produces
    @Singleton
    SyncWorkerPool syncWorkerPool(WorkerPoolConfig config, WorkDispatcher dispatcher) {
        return new SyncWorkerPool(config.workers(), dispatcher);
    }

    void shutdown(@Disposes SyncWorkerPool pool, WorkerPoolConfig config) {
        pool.shutdown(config.shutdownTimeout().toMillis());
    }
}
