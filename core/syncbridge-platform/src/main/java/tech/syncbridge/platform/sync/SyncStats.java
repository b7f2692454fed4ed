package tech.syncbridge.platform.sync;

/**
 * Running counters of a sync job. Mutated only by the worker executing the job.
 */
public class SyncStats {

    public long recordsRead;
    public long recordsWritten;
    public long recordsFailed;
    public long recordsDeduped;
    public long conflicts;

    public SyncStats() {
    }

    public boolean hasFailures() {
        return recordsFailed > 0;
    }

    public boolean hasSuccesses() {
        return recordsWritten > 0;
    }
}
