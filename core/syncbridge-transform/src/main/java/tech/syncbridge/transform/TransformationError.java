package tech.syncbridge.transform;

/**
 * A field level problem found while transforming a record. Depending on the rule it is
 * either a warning (field omitted) or a record level failure.
 */
public record TransformationError(String field, ErrorReason reason, String message) {

    @Override
    public String toString() {
        return field + ": " + reason + " (" + message + ")";
    }
}
