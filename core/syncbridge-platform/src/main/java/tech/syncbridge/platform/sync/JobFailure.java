package tech.syncbridge.platform.sync;

/**
 * User-facing reason a job stopped, with a remediation hint instead of a stack trace.
 */
public record JobFailure(String code, String message, String remediation) {

    public static final String REAUTHORIZATION_REQUIRED = "REAUTHORIZATION_REQUIRED";
    public static final String TARGET_UNREACHABLE = "TARGET_UNREACHABLE";
    public static final String CONFIGURATION_ERROR = "CONFIGURATION_ERROR";
    public static final String ALL_RECORDS_FAILED = "ALL_RECORDS_FAILED";
    public static final String CONCURRENCY_CONFLICT = "CONCURRENCY_CONFLICT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static JobFailure reauthorizationRequired(String message) {
        return new JobFailure(REAUTHORIZATION_REQUIRED, message,
            "Reconnect your account to restore access for this integration.");
    }

    public static JobFailure targetUnreachable(String message) {
        return new JobFailure(TARGET_UNREACHABLE, message,
            "The external platform did not respond. The sync can be retried later.");
    }

    public static JobFailure configurationError(String message) {
        return new JobFailure(CONFIGURATION_ERROR, message,
            "Review the field mappings and entity types configured for this integration.");
    }

    public static JobFailure allRecordsFailed(long failed) {
        return new JobFailure(ALL_RECORDS_FAILED, failed + " records failed and none were written",
            "Check the record errors on this job and adjust the field mapping.");
    }

    public static JobFailure concurrencyConflict(String message) {
        return new JobFailure(CONCURRENCY_CONFLICT, message,
            "Another sync updated this integration at the same time. Trigger the sync again.");
    }

    public static JobFailure internalError(String message) {
        return new JobFailure(INTERNAL_ERROR, message, "Contact support if the problem persists.");
    }
}
