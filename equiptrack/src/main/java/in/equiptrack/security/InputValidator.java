package in.equiptrack.security;

import java.util.regex.Pattern;

/**
 * Input validator for user-supplied identifiers and free text.
 *
 * Validation Rules:
 * - Equipment codes: must match the configured code pattern
 * - Usernames: 3-32 chars, letters, digits, dot, dash, underscore
 * - Passwords: configurable minimum length, max 128
 * - Emails: something@domain.tld
 * - Free text: max 1000 chars, no script or control-character injection
 *
 * {@code isValidX} methods answer yes/no; {@code validateX} methods throw
 * {@link IllegalArgumentException} with a message that is safe to return to clients.
 */
public class InputValidator {

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{3,32}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[0-9 ()-]{6,20}$");

    // Dangerous patterns (injection attempts)
    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CONTROL_CHAR_PATTERN = Pattern.compile(".*[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F].*",
        Pattern.DOTALL);

    private static final int MAX_TEXT_LENGTH = 1000;
    private static final int MAX_PASSWORD_LENGTH = 128;

    private final Pattern codePattern;

    public InputValidator(Pattern codePattern) {
        this.codePattern = codePattern;
    }

    /**
     * Validate an equipment code against the configured pattern.
     *
     * @param code Equipment code as printed on the QR label
     * @return true if valid
     */
    public boolean isValidEquipmentCode(String code) {
        return code != null && codePattern.matcher(code).matches();
    }

    public boolean isValidUsername(String username) {
        return username != null && USERNAME_PATTERN.matcher(username).matches();
    }

    public boolean isValidEmail(String email) {
        return email != null && email.length() <= 254 && EMAIL_PATTERN.matcher(email).matches();
    }

    public boolean isValidPhone(String phone) {
        return phone != null && PHONE_PATTERN.matcher(phone).matches();
    }

    /**
     * Validate free text such as names, locations and notes.
     *
     * @param value    text to check, may be null
     * @param required whether null or blank is an error
     * @return true if valid
     */
    public boolean isSafeText(String value, boolean required) {
        if (value == null || value.isBlank()) {
            return !required;
        }
        if (value.length() > MAX_TEXT_LENGTH) {
            return false;
        }
        return !XSS_PATTERN.matcher(value).matches() && !CONTROL_CHAR_PATTERN.matcher(value).matches();
    }

    public void validateEquipmentCode(String code) {
        if (!isValidEquipmentCode(code)) {
            throw new IllegalArgumentException("Equipment code must match " + codePattern.pattern() + ": " + code);
        }
    }

    public void validateUsername(String username) {
        if (!isValidUsername(username)) {
            throw new IllegalArgumentException("Username must be 3-32 letters, digits, '.', '-' or '_'");
        }
    }

    /**
     * Validate a new password.
     *
     * @param password  candidate password, never echoed in the message
     * @param minLength configured minimum length
     */
    public void validatePassword(String password, int minLength) {
        if (password == null || password.length() < minLength) {
            throw new IllegalArgumentException("Password must be at least " + minLength + " characters");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at most " + MAX_PASSWORD_LENGTH + " characters");
        }
    }

    /**
     * Validate optional contact fields. Null or blank values are allowed.
     */
    public void validateContact(String email, String phone) {
        if (email != null && !email.isBlank() && !isValidEmail(email)) {
            throw new IllegalArgumentException("Invalid email format");
        }
        if (phone != null && !phone.isBlank() && !isValidPhone(phone)) {
            throw new IllegalArgumentException("Invalid phone format");
        }
    }

    public void validateText(String field, String value, boolean required) {
        if (!isSafeText(value, required)) {
            if (required && (value == null || value.isBlank())) {
                throw new IllegalArgumentException(field + " is required");
            }
            throw new IllegalArgumentException(field + " contains invalid content or exceeds "
                + MAX_TEXT_LENGTH + " characters");
        }
    }
}
