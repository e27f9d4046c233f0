package in.equiptrack.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Security event logger that masks sensitive data before it reaches the log.
 *
 * This is the operational log for security-relevant events (logins, privileged
 * operations, restores). It is separate from the ledger's audit trail, which records
 * domain state transitions.
 *
 * Usage:
 * <pre>
 * SecureAuditLogger security = new SecureAuditLogger("IdentityStore");
 * security.logAuthentication("U-1A2B3C4D", true, null);
 * String clean = security.sanitize("password=hunter22&user=ops");
 * // Output: "password=****&user=ops"
 * </pre>
 */
public class SecureAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(SecureAuditLogger.class);

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_PATTERN =
        Pattern.compile("(token|access[_-]?token)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PASSWORD_PATTERN =
        Pattern.compile("(password|passwd|pwd|secret)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern JSON_SECRET_PATTERN =
        Pattern.compile("\"(password|secret|token|oldPassword|newPassword)\"\\s*:\\s*\"[^\"]*\"",
            Pattern.CASE_INSENSITIVE);

    private final String component;

    public SecureAuditLogger(String component) {
        this.component = component;
    }

    /**
     * Log authentication attempt.
     *
     * @param subject user id when known, otherwise a sanitized username
     * @param success success or failure
     * @param reason  failure reason, null on success
     */
    public void logAuthentication(String subject, boolean success, String reason) {
        if (success) {
            log.info("[{}][AUTH] subject={}, success=true", component, sanitize(subject));
        } else {
            log.warn("[{}][AUTH] subject={}, success=false, reason={}", component, sanitize(subject), reason);
        }
    }

    /**
     * Log a privileged (admin-only) operation.
     *
     * @param actorId   acting user id
     * @param operation operation name
     * @param target    affected entity id
     */
    public void logPrivilegedOperation(String actorId, String operation, String target) {
        log.info("[{}][PRIVILEGED] actor={}, operation={}, target={}", component, actorId, operation, target);
    }

    /**
     * Log a denied operation.
     */
    public void logAccessDenied(String actorId, String operation) {
        log.warn("[{}][DENIED] actor={}, operation={}", component, actorId, operation);
    }

    /**
     * Log error with sanitized message.
     *
     * @param operation Operation name
     * @param error Error message (will be sanitized)
     */
    public void logError(String operation, String error) {
        log.error("[{}][ERROR] operation={}, error={}", component, operation, sanitize(error));
    }

    /**
     * Sanitize a string by masking sensitive data.
     *
     * @param input Input string
     * @return Sanitized string
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String result = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("Bearer ****");
        result = TOKEN_PATTERN.matcher(result).replaceAll("$1=****");
        result = PASSWORD_PATTERN.matcher(result).replaceAll("$1=****");
        result = JSON_SECRET_PATTERN.matcher(result).replaceAll("\"$1\":\"****\"");
        return result;
    }

    /**
     * Get redacted version of exception for logging.
     *
     * @param throwable Exception
     * @return Redacted message
     */
    public String getRedactedExceptionMessage(Throwable throwable) {
        if (throwable == null) {
            return "null";
        }
        String message = throwable.getMessage();
        if (message == null) {
            message = throwable.getClass().getSimpleName();
        }
        return sanitize(message);
    }
}
