package tech.syncbridge.transform;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of transforming one record.
 *
 * <p>A successful result carries the target record and any non-fatal warnings.
 * A rejected result carries the errors that caused the whole record to be rejected;
 * its {@code record} is null.</p>
 */
public record TransformResult(
    boolean success,
    Map<String, Object> record,
    List<TransformationError> errors,
    List<TransformationError> warnings
) {

    public static TransformResult success(Map<String, Object> record, List<TransformationError> warnings) {
        return new TransformResult(true, record, List.of(), List.copyOf(warnings));
    }

    public static TransformResult rejected(List<TransformationError> errors, List<TransformationError> warnings) {
        return new TransformResult(false, null, List.copyOf(errors), List.copyOf(warnings));
    }

    /**
     * One line summary of the rejection reasons, suitable for logs and job failure details.
     */
    public String failureSummary() {
        return errors.stream().map(TransformationError::toString).collect(Collectors.joining("; "));
    }
}
