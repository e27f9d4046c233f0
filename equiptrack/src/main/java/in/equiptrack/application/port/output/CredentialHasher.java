package in.equiptrack.application.port.output;

/**
 * One-way credential hashing boundary. Implementations never return or log the raw secret.
 */
public interface CredentialHasher {

    String hash(String secret);

    boolean verify(String secret, String storedHash);
}
