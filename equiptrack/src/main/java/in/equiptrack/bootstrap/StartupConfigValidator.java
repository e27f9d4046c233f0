package in.equiptrack.bootstrap;

import in.equiptrack.config.LedgerConfig;
import in.equiptrack.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Startup configuration validator.
 *
 * Runs before any component is constructed. Every failure is an IllegalStateException and
 * the process refuses to start; nothing here is downgraded to a warning in production mode.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    static final String DEFAULT_SESSION_SECRET = "equiptrack-dev-session-secret-change-me";
    static final String DEFAULT_ADMIN_PASSWORD = "admin12345";
    private static final int MIN_SECRET_LENGTH = 16;

    /**
     * Validate configuration at startup.
     *
     * @param config the already-parsed ledger configuration
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(LedgerConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        log.info("✓ Loan period {} days, default limit {}, long-running alert after {} days",
            config.loanPeriod().toDays(), config.defaultLoanLimit(), config.overdueAlertThreshold().toDays());

        StorageMode mode = StorageMode.parse(Env.get("STORAGE_MODE", "MEMORY"));
        validateStorage(mode);

        String secret = Env.get("SESSION_SECRET", DEFAULT_SESSION_SECRET);
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: SESSION_SECRET must be at least " + MIN_SECRET_LENGTH + " characters");
        }

        boolean productionMode = Env.getBool("PRODUCTION_MODE", false);
        log.info("Production mode: {}", productionMode);
        if (productionMode) {
            validateProductionMode(mode, secret);
        } else {
            warnNonProductionMode(mode, secret);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateStorage(StorageMode mode) {
        switch (mode) {
            case FILE -> {
                Path dir = Paths.get(Env.get("DATA_DIR", "./data"));
                if (Files.exists(dir) && (!Files.isDirectory(dir) || !Files.isWritable(dir))) {
                    throw new IllegalStateException(
                        "❌ INVALID CONFIG: DATA_DIR is not a writable directory: " + dir.toAbsolutePath());
                }
                log.info("✓ File storage at {}", dir.toAbsolutePath());
            }
            case POSTGRES -> {
                String url = Env.get("DB_URL", null);
                if (url == null || !url.startsWith("jdbc:postgresql:")) {
                    throw new IllegalStateException(
                        "❌ INVALID CONFIG: STORAGE_MODE=POSTGRES requires DB_URL=jdbc:postgresql://...");
                }
                log.info("✓ PostgreSQL storage at {}", url);
            }
            case MEMORY -> log.info("✓ In-memory storage");
        }
    }

    private static void validateProductionMode(StorageMode mode, String secret) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (mode == StorageMode.MEMORY) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires durable storage\n" +
                "Set STORAGE_MODE=FILE or STORAGE_MODE=POSTGRES, or set PRODUCTION_MODE=false");
        }
        if (DEFAULT_SESSION_SECRET.equals(secret)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE forbids the built-in SESSION_SECRET");
        }
        if (DEFAULT_ADMIN_PASSWORD.equals(Env.get("ADMIN_PASSWORD", DEFAULT_ADMIN_PASSWORD))) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE forbids the built-in ADMIN_PASSWORD");
        }
        log.info("✓ Durable storage and non-default secrets");
    }

    private static void warnNonProductionMode(StorageMode mode, String secret) {
        if (mode == StorageMode.MEMORY) {
            log.warn("⚠️ In-memory storage: all data is lost on shutdown");
        }
        if (DEFAULT_SESSION_SECRET.equals(secret)) {
            log.warn("⚠️ Using built-in SESSION_SECRET (dev only)");
        }
    }

    private StartupConfigValidator() {}
}
