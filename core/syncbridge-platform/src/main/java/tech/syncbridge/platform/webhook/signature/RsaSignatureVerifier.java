package tech.syncbridge.platform.webhook.signature;

import org.jboss.logging.Logger;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * SHA256withRSA signature, Base64 encoded, checked against the provider's PEM public key.
 */
public class RsaSignatureVerifier implements SignatureVerifier {

    private static final Logger LOG = Logger.getLogger(RsaSignatureVerifier.class);
    private static final String ALGORITHM = "SHA256withRSA";

    @Override
    public boolean verify(byte[] rawBody, String signature, String secret) {
        if (signature == null || signature.isBlank() || secret == null || secret.isBlank()) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(parsePublicKey(secret));
            verifier.update(rawBody);
            return verifier.verify(Base64.getDecoder().decode(signature.trim()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.debugf("RSA signature rejected: %s", e.getMessage());
            return false;
        }
    }

    static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        String base64 = pem
            .replace("-----BEGIN PUBLIC KEY-----", "")
            .replace("-----END PUBLIC KEY-----", "")
            .replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    }
}
