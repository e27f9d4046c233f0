package in.equiptrack.config;

import in.equiptrack.util.Env;

import java.time.Duration;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ledger engine configuration.
 *
 * Loan period, default loan limit and the long-running-loan alert threshold have no built-in
 * values: they must be supplied by the deployment. The remaining knobs fall back to
 * conservative defaults.
 */
public record LedgerConfig(
    Duration loanPeriod,              // dueAt = issuedAt + loanPeriod
    int defaultLoanLimit,             // used when a supervisor has no individual limit
    Duration overdueAlertThreshold,   // open loans older than this are reported as long-running
    String equipmentCodePattern,      // regex every equipment code must match
    String returnLocation,            // location set on return; null keeps the deployment location
    Duration snapshotTimeout,         // max wait for a durable snapshot write
    Duration autoSnapshotInterval,    // ZERO disables periodic snapshots
    Duration sessionTimeout,          // bearer token lifetime
    int maxLoginAttempts,             // consecutive failures before lockout
    Duration loginLockout,
    int minPasswordLength
) {
    public static final String DEFAULT_CODE_PATTERN = "^[A-Z0-9-]{5,}$";

    /**
     * Config with the required values and defaults for everything else.
     */
    public static LedgerConfig of(Duration loanPeriod, int defaultLoanLimit, Duration overdueAlertThreshold) {
        return new LedgerConfig(
            loanPeriod,
            defaultLoanLimit,
            overdueAlertThreshold,
            DEFAULT_CODE_PATTERN,
            null,
            Duration.ofSeconds(30),
            Duration.ZERO,
            Duration.ofMinutes(30),
            3,
            Duration.ofMinutes(15),
            8
        );
    }

    /**
     * Load from environment variables (or system properties).
     *
     * @throws IllegalStateException if a required value is missing or malformed
     */
    public static LedgerConfig fromEnv() {
        LedgerConfig config = new LedgerConfig(
            Duration.ofDays(Env.requireInt("LOAN_PERIOD_DAYS")),
            Env.requireInt("DEFAULT_LOAN_LIMIT"),
            Duration.ofDays(Env.requireInt("OVERDUE_ALERT_DAYS")),
            Env.get("EQUIPMENT_CODE_PATTERN", DEFAULT_CODE_PATTERN),
            Env.get("RETURN_LOCATION", null),
            Duration.ofSeconds(Env.getLong("SNAPSHOT_TIMEOUT_SECONDS", 30)),
            Duration.ofMinutes(Env.getLong("AUTO_SNAPSHOT_MINUTES", 0)),
            Duration.ofMinutes(Env.getLong("SESSION_TIMEOUT_MINUTES", 30)),
            Env.getInt("MAX_LOGIN_ATTEMPTS", 3),
            Duration.ofMinutes(Env.getLong("LOGIN_LOCKOUT_MINUTES", 15)),
            Env.getInt("MIN_PASSWORD_LENGTH", 8)
        );
        if (!config.isValid()) {
            throw new IllegalStateException("Invalid ledger configuration: " + config);
        }
        return config;
    }

    public Pattern codePattern() {
        return Pattern.compile(equipmentCodePattern);
    }

    public LedgerConfig withReturnLocation(String location) {
        return new LedgerConfig(loanPeriod, defaultLoanLimit, overdueAlertThreshold, equipmentCodePattern,
            location, snapshotTimeout, autoSnapshotInterval, sessionTimeout, maxLoginAttempts, loginLockout,
            minPasswordLength);
    }

    public LedgerConfig withSnapshotTimeout(Duration timeout) {
        return new LedgerConfig(loanPeriod, defaultLoanLimit, overdueAlertThreshold, equipmentCodePattern,
            returnLocation, timeout, autoSnapshotInterval, sessionTimeout, maxLoginAttempts, loginLockout,
            minPasswordLength);
    }

    public LedgerConfig withLoginPolicy(int attempts, Duration lockout) {
        return new LedgerConfig(loanPeriod, defaultLoanLimit, overdueAlertThreshold, equipmentCodePattern,
            returnLocation, snapshotTimeout, autoSnapshotInterval, sessionTimeout, attempts, lockout,
            minPasswordLength);
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return isPositive(loanPeriod)
            && defaultLoanLimit >= 0
            && isPositive(overdueAlertThreshold)
            && isValidPattern(equipmentCodePattern)
            && isPositive(snapshotTimeout)
            && autoSnapshotInterval != null && !autoSnapshotInterval.isNegative()
            && isPositive(sessionTimeout)
            && maxLoginAttempts > 0
            && loginLockout != null && !loginLockout.isNegative()
            && minPasswordLength > 0;
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    private static boolean isValidPattern(String regex) {
        if (regex == null || regex.isBlank()) {
            return false;
        }
        try {
            Pattern.compile(regex);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
