package tech.syncbridge.transform.mapping;

import java.util.List;

/**
 * A mapping failed validation. This is a configuration error and is raised when
 * a mapping is written, never while a job is running.
 */
public class MappingValidationException extends RuntimeException {

    private final List<MappingViolation> violations;

    public MappingValidationException(List<MappingViolation> violations) {
        super("Invalid field mapping: " + violations.size() + " violation(s), first: "
            + (violations.isEmpty() ? "none" : violations.get(0).message()));
        this.violations = List.copyOf(violations);
    }

    public List<MappingViolation> getViolations() {
        return violations;
    }
}
