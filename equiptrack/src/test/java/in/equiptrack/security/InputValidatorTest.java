package in.equiptrack.security;

import in.equiptrack.config.LedgerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator security validations.
 */
@DisplayName("Input Validator Security Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator(Pattern.compile(LedgerConfig.DEFAULT_CODE_PATTERN));
    }

    @Test
    @DisplayName("Valid equipment codes pass validation")
    public void testValidEquipmentCodes() {
        assertTrue(validator.isValidEquipmentCode("EQ-001"));
        assertTrue(validator.isValidEquipmentCode("DRILL2024"));
        assertTrue(validator.isValidEquipmentCode("12345"));
    }

    @Test
    @DisplayName("Invalid equipment codes fail validation")
    public void testInvalidEquipmentCodes() {
        assertFalse(validator.isValidEquipmentCode(null));
        assertFalse(validator.isValidEquipmentCode(""));
        assertFalse(validator.isValidEquipmentCode("EQ1"));
        assertFalse(validator.isValidEquipmentCode("eq-001"));
        assertFalse(validator.isValidEquipmentCode("EQ 001"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateEquipmentCode("EQ'; DROP--"));
    }

    @Test
    @DisplayName("Custom code pattern is honoured")
    public void testCustomCodePattern() {
        InputValidator custom = new InputValidator(Pattern.compile("^QR[0-9]{4}$"));

        assertTrue(custom.isValidEquipmentCode("QR1234"));
        assertFalse(custom.isValidEquipmentCode("EQ-001"));
    }

    @Test
    @DisplayName("Usernames")
    public void testUsernames() {
        assertTrue(validator.isValidUsername("supervisor.one"));
        assertTrue(validator.isValidUsername("tech_2"));
        assertFalse(validator.isValidUsername("ab"));
        assertFalse(validator.isValidUsername("has space"));
        assertFalse(validator.isValidUsername("a".repeat(33)));
        assertThrows(IllegalArgumentException.class, () -> validator.validateUsername("<b>"));
    }

    @Test
    @DisplayName("Password length bounds")
    public void testPasswords() {
        assertDoesNotThrow(() -> validator.validatePassword("12345678", 8));
        assertThrows(IllegalArgumentException.class, () -> validator.validatePassword("1234567", 8));
        assertThrows(IllegalArgumentException.class, () -> validator.validatePassword(null, 8));
        assertThrows(IllegalArgumentException.class, () -> validator.validatePassword("x".repeat(129), 8));
    }

    @Test
    @DisplayName("Password never appears in the error message")
    public void testPasswordNotEchoed() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> validator.validatePassword("s3cr3t", 8));
        assertFalse(ex.getMessage().contains("s3cr3t"));
    }

    @Test
    @DisplayName("Optional contact fields")
    public void testContacts() {
        assertDoesNotThrow(() -> validator.validateContact(null, null));
        assertDoesNotThrow(() -> validator.validateContact("ops@example.com", "+44 20 7946 0000"));
        assertThrows(IllegalArgumentException.class, () -> validator.validateContact("ops@", null));
        assertThrows(IllegalArgumentException.class, () -> validator.validateContact(null, "call me"));
    }

    @Test
    @DisplayName("Script injection and control characters detected in free text")
    public void testUnsafeText() {
        assertTrue(validator.isSafeText("Warehouse A, shelf 3", true));
        assertTrue(validator.isSafeText(null, false));
        assertFalse(validator.isSafeText("  ", true));
        assertFalse(validator.isSafeText("<script>alert(1)</script>", false));
        assertFalse(validator.isSafeText("javascript:alert(1)", false));
        assertFalse(validator.isSafeText("bad\u0000byte", false));
        assertFalse(validator.isSafeText("x".repeat(1001), false));
        assertTrue(validator.isSafeText("line one\nline two", false));
    }

    @Test
    @DisplayName("Required text reports the field name")
    public void testRequiredTextMessage() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> validator.validateText("name", "", true));
        assertEquals("name is required", ex.getMessage());
    }
}
