package in.equiptrack.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SaltedSha256CredentialHasherTest {

    private final SaltedSha256CredentialHasher hasher = new SaltedSha256CredentialHasher(100);

    @Test
    void verifiesMatchingSecret() {
        String stored = hasher.hash("correct horse");

        assertTrue(hasher.verify("correct horse", stored));
        assertFalse(hasher.verify("correct horse!", stored));
    }

    @Test
    void saltMakesHashesDiffer() {
        assertNotEquals(hasher.hash("same-secret"), hasher.hash("same-secret"));
    }

    @Test
    void storedFormNeverContainsSecret() {
        String stored = hasher.hash("plaintext-secret");

        assertFalse(stored.contains("plaintext-secret"));
        assertEquals(2, stored.split("\\$").length);
    }

    @Test
    void malformedStoredHashFailsVerification() {
        assertFalse(hasher.verify("x", "no-separator"));
        assertFalse(hasher.verify("x", "%%%$%%%"));
        assertFalse(hasher.verify(null, hasher.hash("x")));
        assertFalse(hasher.verify("x", null));
    }

    @Test
    void iterationCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SaltedSha256CredentialHasher(0));
    }
}
