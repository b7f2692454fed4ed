package tech.syncbridge.platform.sync;

import java.time.Instant;

/**
 * What one run of a job ended with. A non-terminal status means the job was rescheduled
 * (throttled, transient failure, watermark conflict) or was not eligible to run.
 */
public record JobResult(String jobId, SyncJobStatus status, SyncStats stats, JobFailure failure, Instant nextAttemptAt) {

    public static JobResult of(SyncJob job) {
        return new JobResult(job.id, job.status, job.stats, job.failure, job.nextAttemptAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
