package in.equiptrack.auth;

import in.equiptrack.application.port.output.CredentialHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Salted, iterated SHA-256 credential hasher.
 *
 * Stored form: {@code base64(salt)$base64(hash)}. Comparison is constant-time.
 */
public final class SaltedSha256CredentialHasher implements CredentialHasher {
    private static final Logger log = LoggerFactory.getLogger(SaltedSha256CredentialHasher.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int SALT_BYTES = 16;

    private final int iterations;

    public SaltedSha256CredentialHasher() {
        this(10_000);
    }

    public SaltedSha256CredentialHasher(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1");
        }
        this.iterations = iterations;
    }

    @Override
    public String hash(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret required");
        }
        byte[] salt = new byte[SALT_BYTES];
        RANDOM.nextBytes(salt);
        byte[] hash = digest(salt, secret);

        // Encode as salt$hash
        return Base64.getEncoder().encodeToString(salt) + "$" +
               Base64.getEncoder().encodeToString(hash);
    }

    @Override
    public boolean verify(String secret, String storedHash) {
        if (secret == null || storedHash == null) {
            return false;
        }
        String[] parts = storedHash.split("\\$");
        if (parts.length != 2) {
            log.warn("Stored credential hash has unexpected format");
            return false;
        }

        byte[] salt;
        byte[] expectedHash;
        try {
            salt = Base64.getDecoder().decode(parts[0]);
            expectedHash = Base64.getDecoder().decode(parts[1]);
        } catch (IllegalArgumentException e) {
            log.warn("Stored credential hash is not valid base64: {}", e.getMessage());
            return false;
        }

        return MessageDigest.isEqual(expectedHash, digest(salt, secret));
    }

    private byte[] digest(byte[] salt, String secret) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(salt);
            byte[] hash = md.digest(secret.getBytes(StandardCharsets.UTF_8));
            for (int i = 1; i < iterations; i++) {
                md.reset();
                md.update(salt);
                hash = md.digest(hash);
            }
            return hash;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
