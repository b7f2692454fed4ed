package tech.syncbridge.platform.webhook.signature;

import org.jboss.logging.Logger;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 over the raw body, hex encoded, optionally prefixed with {@code sha256=}.
 */
public class HmacSignatureVerifier implements SignatureVerifier {

    private static final Logger LOG = Logger.getLogger(HmacSignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    @Override
    public boolean verify(byte[] rawBody, String signature, String secret) {
        if (signature == null || signature.isBlank() || secret == null || secret.isEmpty()) {
            return false;
        }
        String provided = signature.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }
        String expected;
        try {
            expected = sign(rawBody, secret);
        } catch (GeneralSecurityException e) {
            LOG.errorf(e, "HMAC computation failed");
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII), provided.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Hex HMAC of a body, as a provider would send it (without prefix).
     */
    public static String sign(byte[] rawBody, String secret) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(rawBody));
    }
}
