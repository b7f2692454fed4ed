package tech.syncbridge.platform.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AES-256-GCM encryption with tenant-scoped keys.
 *
 * <p>Each tenant key is derived as HMAC-SHA256(masterKey, "tenant:" + tenantId), so a
 * ciphertext can only be opened with its own tenant's key. The instance id is bound as
 * additional authenticated data, which stops a ciphertext from being replayed onto
 * another instance of the same tenant.</p>
 *
 * Ciphertext format: Base64(IV (12 bytes) + encrypted data + auth tag (16 bytes)).
 *
 * Master key configuration (in order of precedence):
 * <ol>
 *   <li>{@code syncbridge.credentials.master-key} - Base64-encoded 256-bit key
 *       (generate with: openssl rand -base64 32)</li>
 *   <li>{@code syncbridge.credentials.passphrase} + {@code salt} - PBKDF2 derived key</li>
 * </ol>
 */
@ApplicationScoped
public class CredentialCipher {

    private static final Logger LOG = Logger.getLogger(CredentialCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey masterKey;
    private final Map<String, SecretKey> tenantKeys = new ConcurrentHashMap<>();

    @Inject
    public CredentialCipher(
            @ConfigProperty(name = "syncbridge.credentials.master-key") Optional<String> masterKey,
            @ConfigProperty(name = "syncbridge.credentials.passphrase") Optional<String> passphrase,
            @ConfigProperty(name = "syncbridge.credentials.salt", defaultValue = "syncbridge-default-salt") String salt) {
        if (masterKey.isPresent() && !masterKey.get().isBlank()) {
            this.masterKey = parseKey(masterKey.get());
            LOG.info("Credential cipher initialized with master key");
        } else if (passphrase.isPresent() && !passphrase.get().isBlank()) {
            this.masterKey = deriveKey(passphrase.get(), salt);
            LOG.info("Credential cipher initialized with derived key from passphrase");
        } else {
            LOG.warn("No credential master key configured. Credentials cannot be stored or read. " +
                "Set syncbridge.credentials.master-key. Generate with: openssl rand -base64 32");
            this.masterKey = null;
        }
    }

    /**
     * Cipher with an explicit Base64 master key, or without one when null.
     */
    public static CredentialCipher withMasterKey(String base64Key) {
        return new CredentialCipher(Optional.ofNullable(base64Key), Optional.empty(), "unused");
    }

    public boolean isAvailable() {
        return masterKey != null;
    }

    public String encrypt(String tenantId, String instanceId, String plaintext) {
        SecretKey key = tenantKey(tenantId);
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(instanceId.getBytes(StandardCharsets.UTF_8));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt credential for instance " + instanceId, e);
        }
    }

    public String decrypt(String tenantId, String instanceId, String encoded) {
        SecretKey key = tenantKey(tenantId);
        try {
            ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(encoded));
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(instanceId.getBytes(StandardCharsets.UTF_8));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EncryptionException("Failed to decrypt credential for instance " + instanceId, e);
        }
    }

    private SecretKey tenantKey(String tenantId) {
        if (masterKey == null) {
            throw new EncryptionException("Credential master key not configured");
        }
        return tenantKeys.computeIfAbsent(tenantId, this::deriveTenantKey);
    }

    private SecretKey deriveTenantKey(String tenantId) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(masterKey.getEncoded(), "HmacSHA256"));
            byte[] keyBytes = mac.doFinal(("tenant:" + tenantId).getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to derive key for tenant " + tenantId, e);
        }
    }

    private static SecretKey parseKey(String base64Key) {
        try {
            byte[] keyBytes = Base64.getDecoder().decode(base64Key);
            if (keyBytes.length != 32) {
                throw new IllegalStateException(
                    "syncbridge.credentials.master-key must be 256 bits (32 bytes) Base64-encoded. Got: "
                        + keyBytes.length + " bytes");
            }
            return new SecretKeySpec(keyBytes, "AES");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("syncbridge.credentials.master-key must be valid Base64", e);
        }
    }

    private static SecretKey deriveKey(String passphrase, String salt) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            KeySpec spec = new PBEKeySpec(
                passphrase.toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8),
                65536,  // iterations
                256     // key length in bits
            );
            return new SecretKeySpec(factory.generateSecret(spec).getEncoded(), "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive credential master key", e);
        }
    }
}
