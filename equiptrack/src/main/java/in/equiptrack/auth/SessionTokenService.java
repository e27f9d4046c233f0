package in.equiptrack.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.equiptrack.domain.user.Role;
import in.equiptrack.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session tokens in compact JWT form, signed with HMAC-SHA256.
 *
 * Tokens carry the user id and role at login time. Callers must still re-check the
 * user against the identity store on every request, since roles and status can change
 * while a token is live.
 *
 * THREAD-SAFETY: safe for concurrent use.
 */
public final class SessionTokenService {
    private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final byte[] secret;
    private final Duration sessionTimeout;
    private final Clock clock;

    // Revoked token -> its expiry; entries are dropped once the token would have expired anyway
    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

    public SessionTokenService(String secret, Duration sessionTimeout, Clock clock) {
        if (secret == null || secret.length() < 16) {
            throw new IllegalArgumentException("Session secret must be at least 16 characters");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.sessionTimeout = sessionTimeout;
        this.clock = clock;
    }

    /**
     * Issue a token for an authenticated user.
     */
    public String issue(User user) {
        Instant now = clock.instant();
        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", user.userId());
        claims.put("role", user.role().name());
        claims.put("jti", UUID.randomUUID().toString());
        claims.put("iat", now.getEpochSecond());
        claims.put("exp", now.plus(sessionTimeout).getEpochSecond());

        String payload;
        try {
            payload = base64Encode(MAPPER.writeValueAsString(claims));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode session claims", e);
        }
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    /**
     * Validate a token (optionally prefixed with "Bearer ") and return its claims.
     * Empty for malformed, forged, expired or revoked tokens.
     */
    public Optional<SessionClaims> validate(String token) {
        token = stripBearer(token);
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return Optional.empty();
        }

        byte[] expectedSig = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expectedSig, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Invalid token signature");
            return Optional.empty();
        }

        SessionClaims claims;
        try {
            JsonNode node = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            claims = new SessionClaims(
                node.path("sub").asText(null),
                Role.valueOf(node.path("role").asText()),
                Instant.ofEpochSecond(node.path("iat").asLong()),
                Instant.ofEpochSecond(node.path("exp").asLong())
            );
        } catch (Exception e) {
            log.debug("Token claims unreadable: {}", e.getMessage());
            return Optional.empty();
        }

        if (claims.userId() == null) {
            log.debug("Missing required claims");
            return Optional.empty();
        }
        if (!clock.instant().isBefore(claims.expiresAt())) {
            log.debug("Token expired");
            return Optional.empty();
        }
        if (revoked.containsKey(token)) {
            log.debug("Token is revoked");
            return Optional.empty();
        }
        return Optional.of(claims);
    }

    /**
     * Revoke a token (logout). Unknown or malformed tokens are ignored.
     */
    public void revoke(String token) {
        String raw = stripBearer(token);
        if (raw == null || raw.isEmpty()) {
            return;
        }
        validate(raw).ifPresent(c -> revoked.put(raw, c.expiresAt()));
    }

    /**
     * Drop revocations whose tokens have expired anyway.
     *
     * @return number of entries removed
     */
    public int purgeRevoked() {
        Instant now = clock.instant();
        int before = revoked.size();
        revoked.entrySet().removeIf(e -> !now.isBefore(e.getValue()));
        return before - revoked.size();
    }

    public int revokedCount() {
        return revoked.size();
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
    }

    private static String stripBearer(String token) {
        if (token != null && token.startsWith("Bearer ")) {
            return token.substring(7).trim();
        }
        return token;
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Token claims record.
     */
    public record SessionClaims(
        String userId,
        Role role,
        Instant issuedAt,
        Instant expiresAt
    ) {}
}
