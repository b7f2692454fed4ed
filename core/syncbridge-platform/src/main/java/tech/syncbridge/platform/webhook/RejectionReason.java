package tech.syncbridge.platform.webhook;

/**
 * Why an inbound webhook was refused, with the HTTP status the endpoint answers.
 */
public enum RejectionReason {
    INVALID_SIGNATURE(401),
    UNSUPPORTED_PROVIDER(404),
    UNKNOWN_INSTANCE(404),
    PROVIDER_MISMATCH(404),
    INSTANCE_INACTIVE(410),
    MALFORMED_PAYLOAD(400),
    CREDENTIAL_UNAVAILABLE(503);

    private final int httpStatus;

    RejectionReason(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
