package tech.syncbridge.platform.webhook.signature;

/**
 * Checks that a webhook body was signed by the provider.
 */
public interface SignatureVerifier {

    /**
     * @param rawBody   body exactly as received
     * @param signature value of the provider's signature header, may be null
     * @param secret    shared secret or verification key stored with the instance credential
     * @return false for a missing, malformed or non-matching signature
     */
    boolean verify(byte[] rawBody, String signature, String secret);
}
