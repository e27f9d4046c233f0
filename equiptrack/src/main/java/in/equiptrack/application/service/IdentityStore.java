package in.equiptrack.application.service;

import in.equiptrack.application.port.output.CredentialHasher;
import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.config.LedgerConfig;
import in.equiptrack.domain.audit.AuditAction;
import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.audit.EntityType;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.user.NewUser;
import in.equiptrack.domain.user.Permission;
import in.equiptrack.domain.user.Role;
import in.equiptrack.domain.user.User;
import in.equiptrack.domain.user.UserStatus;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.security.InputValidator;
import in.equiptrack.security.SecureAuditLogger;
import in.equiptrack.util.LedgerJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Identity & Role Store.
 *
 * PURPOSE:
 * Owns users, their roles and credential hashes. Authenticates logins and answers
 * capability checks for every mutator in the system.
 *
 * SECURITY:
 * Raw secrets are hashed on receipt and never logged or stored. Consecutive login
 * failures for a username lock it for the configured period.
 *
 * THREAD-SAFETY:
 * Mutations run under this store's own lock; reads use an immutable published map.
 */
public final class IdentityStore {
    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);

    public static final String SYSTEM_ACTOR = "system";
    static final String KEY_PREFIX = "user/";

    private final LedgerStorage storage;
    private final AuditedCommitter committer;
    private final CredentialHasher hasher;
    private final InputValidator validator;
    private final LedgerConfig config;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final SecureAuditLogger security = new SecureAuditLogger("IdentityStore");
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Map<String, User> users = Map.of();

    // Normalized username -> consecutive failures; in memory only
    private final Map<String, LoginFailures> failures = new ConcurrentHashMap<>();

    public IdentityStore(LedgerStorage storage, AuditTrail auditTrail, CredentialHasher hasher,
                         InputValidator validator, LedgerConfig config, Clock clock, LedgerMetrics metrics) {
        this.storage = storage;
        this.committer = new AuditedCommitter(storage, auditTrail);
        this.hasher = hasher;
        this.validator = validator;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Load persisted users. Called once at startup.
     */
    public void load() {
        List<User> loaded = LedgerJson.decodeAll(storage.readAll(KEY_PREFIX), User.class);
        withLock(() -> {
            publish(loaded);
            return null;
        });
        log.info("Identity store loaded: {} users", loaded.size());
    }

    // ═══════════════════════════════════════════════════════════════
    // Authentication
    // ═══════════════════════════════════════════════════════════════

    /**
     * Verify a username and secret.
     *
     * @return the user id
     * @throws LedgerException AUTH_FAILED for unknown users, wrong secrets, deactivated users
     *                         and locked-out usernames; the message never says which
     */
    public String authenticate(String username, String secret) {
        String normalized = normalize(username);
        Instant now = clock.instant();

        LoginFailures current = failures.get(normalized);
        if (current != null && current.isLocked(now)) {
            metrics.recordAuthentication(false);
            security.logAuthentication(normalized, false, "locked");
            throw new LedgerException(LedgerErrorCode.AUTH_FAILED);
        }

        Optional<User> user = findByUsername(normalized);
        boolean ok = user.isPresent()
            && user.get().isActive()
            && secret != null
            && hasher.verify(secret, user.get().credentialHash());

        if (!ok) {
            LoginFailures next = failures.compute(normalized, (k, prev) -> {
                int count = prev == null || prev.lockExpired(now) ? 1 : prev.count() + 1;
                Instant lockedUntil = count >= config.maxLoginAttempts() ? now.plus(config.loginLockout()) : null;
                return new LoginFailures(count, lockedUntil);
            });
            metrics.recordAuthentication(false);
            security.logAuthentication(normalized, false,
                next.isLocked(now) ? "locked after " + next.count() + " failures" : "invalid credentials");
            throw new LedgerException(LedgerErrorCode.AUTH_FAILED);
        }

        failures.remove(normalized);
        metrics.recordAuthentication(true);
        security.logAuthentication(user.get().userId(), true, null);
        return user.get().userId();
    }

    // ═══════════════════════════════════════════════════════════════
    // Authorization
    // ═══════════════════════════════════════════════════════════════

    /**
     * Whether an active user holds one of the given roles.
     */
    public boolean authorize(String userId, Set<Role> roles) {
        User user = users.get(userId);
        return user != null && user.isActive() && roles.contains(user.role());
    }

    /**
     * Whether an active user holds the capability.
     */
    public boolean authorize(String userId, Permission permission) {
        User user = users.get(userId);
        return user != null && user.isActive() && permission.grantedTo(user.role());
    }

    /**
     * Require a capability.
     *
     * @return the acting user
     * @throws LedgerException UNAUTHORIZED if the user is unknown, inactive or lacks the capability
     */
    public User require(String userId, Permission permission) {
        if (!authorize(userId, permission)) {
            security.logAccessDenied(userId, permission.name());
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED, permission.name());
        }
        return users.get(userId);
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    public Optional<User> find(String userId) {
        return Optional.ofNullable(userId == null ? null : users.get(userId));
    }

    public Optional<User> findByUsername(String username) {
        String normalized = normalize(username);
        return users.values().stream()
            .filter(u -> u.username().equals(normalized))
            .findFirst();
    }

    /**
     * All users ordered by username.
     */
    public List<User> listUsers() {
        return users.values().stream()
            .sorted(Comparator.comparing(User::username))
            .toList();
    }

    /**
     * Users with the SUPERVISOR role, optionally filtered by department.
     */
    public List<User> supervisors(String department) {
        return users.values().stream()
            .filter(User::isSupervisor)
            .filter(u -> department == null || department.equalsIgnoreCase(u.department()))
            .sorted(Comparator.comparing(User::username))
            .toList();
    }

    /**
     * Immutable view of all users, for snapshots.
     */
    public Collection<User> view() {
        return users.values();
    }

    // ═══════════════════════════════════════════════════════════════
    // Administrative mutators
    // ═══════════════════════════════════════════════════════════════

    /**
     * Create a user.
     *
     * @param request new user data with the raw secret
     * @param actorId administrator performing the change
     * @return the created user
     */
    public User createUser(NewUser request, String actorId) {
        require(actorId, Permission.MANAGE_USERS);
        return create(request, actorId);
    }

    /**
     * Create the first administrator if no active administrator exists.
     *
     * @return the created user, or empty if an administrator already exists
     */
    public Optional<User> bootstrapAdmin(String username, String secret) {
        return withLock(() -> {
            boolean hasAdmin = users.values().stream().anyMatch(u -> u.isAdmin() && u.isActive());
            if (hasAdmin) {
                return Optional.<User>empty();
            }
            User admin = create(NewUser.of(username, "Administrator", secret, Role.ADMINISTRATOR), SYSTEM_ACTOR);
            log.info("Bootstrap administrator created: {}", admin.userId());
            return Optional.of(admin);
        });
    }

    public User changeRole(String userId, Role newRole, String actorId) {
        require(actorId, Permission.MANAGE_USERS);
        if (newRole == null) {
            throw LedgerException.invalidInput("role is required");
        }
        return withLock(() -> {
            User current = existing(userId);
            if (current.role() == newRole) {
                return current;
            }
            if (current.isAdmin() && current.isActive() && activeAdminCount() == 1) {
                throw LedgerException.invalidInput("cannot demote the last active administrator");
            }
            Integer limit = newRole == Role.SUPERVISOR ? current.loanLimit() : null;
            User updated = current.withRole(newRole, clock.instant()).withLoanLimit(limit, clock.instant());
            commit(updated, current, AuditDraft.of(actorId, AuditAction.USER_ROLE_CHANGED, EntityType.USER,
                userId, current.role().name(), newRole.name()));
            security.logPrivilegedOperation(actorId, "changeRole", userId);
            return updated;
        });
    }

    public User deactivate(String userId, String actorId) {
        require(actorId, Permission.MANAGE_USERS);
        return withLock(() -> {
            User current = existing(userId);
            if (!current.isActive()) {
                return current;
            }
            if (current.isAdmin() && activeAdminCount() == 1) {
                throw LedgerException.invalidInput("cannot deactivate the last active administrator");
            }
            User updated = current.withStatus(UserStatus.DEACTIVATED, clock.instant());
            commit(updated, current, AuditDraft.of(actorId, AuditAction.USER_DEACTIVATED, EntityType.USER,
                userId, UserStatus.ACTIVE.name(), UserStatus.DEACTIVATED.name()));
            security.logPrivilegedOperation(actorId, "deactivate", userId);
            return updated;
        });
    }

    /**
     * Set or clear a supervisor's individual loan limit. Existing loans are unaffected;
     * the new limit only constrains future issuance.
     *
     * @param limit new limit, or null to fall back to the configured default
     */
    public User setLoanLimit(String userId, Integer limit, String actorId) {
        require(actorId, Permission.MANAGE_USERS);
        if (limit != null && limit < 0) {
            throw LedgerException.invalidInput("loan limit must be >= 0");
        }
        return withLock(() -> {
            User current = existing(userId);
            if (!current.isSupervisor()) {
                throw LedgerException.invalidInput("loan limits apply to supervisors only");
            }
            User updated = current.withLoanLimit(limit, clock.instant());
            commit(updated, current, AuditDraft.of(actorId, AuditAction.USER_LOAN_LIMIT_CHANGED, EntityType.USER,
                userId, limitLabel(current.loanLimit()), limitLabel(limit)));
            return updated;
        });
    }

    /**
     * Self-service password change.
     *
     * @throws LedgerException AUTH_FAILED if the old secret does not match
     */
    public void changePassword(String userId, String oldSecret, String newSecret) {
        withLock(() -> {
            User current = existing(userId);
            if (!current.isActive() || oldSecret == null || !hasher.verify(oldSecret, current.credentialHash())) {
                security.logAuthentication(userId, false, "password change rejected");
                throw new LedgerException(LedgerErrorCode.AUTH_FAILED);
            }
            validate(() -> validator.validatePassword(newSecret, config.minPasswordLength()));
            User updated = current.withCredentialHash(hasher.hash(newSecret), clock.instant());
            commit(updated, current, AuditDraft.of(userId, AuditAction.USER_PASSWORD_CHANGED, EntityType.USER,
                userId, null, null));
            return null;
        });
    }

    /**
     * Hold this store's lock while running {@code action}.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publish restored users. Caller must hold the lock and have written the same records to storage.
     */
    void replaceUsers(Collection<User> restored) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("replaceUsers requires the identity lock");
        }
        publish(restored);
        failures.clear();
    }

    static String key(String userId) {
        return KEY_PREFIX + userId;
    }

    private User create(NewUser request, String actorId) {
        if (request == null || request.role() == null) {
            throw LedgerException.invalidInput("role is required");
        }
        String username = normalize(request.username());
        validate(() -> {
            validator.validateUsername(username);
            validator.validateText("displayName", request.displayName(), true);
            validator.validatePassword(request.secret(), config.minPasswordLength());
            validator.validateContact(request.email(), request.phone());
            validator.validateText("department", request.department(), false);
        });
        if (request.loanLimit() != null) {
            if (request.role() != Role.SUPERVISOR) {
                throw LedgerException.invalidInput("loan limits apply to supervisors only");
            }
            if (request.loanLimit() < 0) {
                throw LedgerException.invalidInput("loan limit must be >= 0");
            }
        }

        String hash = hasher.hash(request.secret());
        return withLock(() -> {
            if (findByUsername(username).isPresent()) {
                throw LedgerException.invalidInput("username already exists: " + username);
            }
            Instant now = clock.instant();
            User user = new User(newUserId(), username, request.displayName().trim(), hash, request.role(),
                UserStatus.ACTIVE, request.loanLimit(), blankToNull(request.email()), blankToNull(request.phone()),
                blankToNull(request.department()), now, now);
            commit(user, null, AuditDraft.of(actorId, AuditAction.USER_CREATED, EntityType.USER,
                user.userId(), null, UserStatus.ACTIVE.name()).withDetails("role=" + user.role()));
            security.logPrivilegedOperation(actorId, "createUser", user.userId());
            return user;
        });
    }

    private void commit(User updated, User previous, AuditDraft draft) {
        Map<String, User> next = new TreeMap<>(users);
        next.put(updated.userId(), updated);
        Map<String, User> published = Collections.unmodifiableMap(next);
        committer.commit(new RecordBatch().put(key(updated.userId()), updated, previous).audit(draft),
            () -> users = published);
    }

    private void publish(Collection<User> all) {
        Map<String, User> next = new TreeMap<>();
        for (User u : all) {
            next.put(u.userId(), u);
        }
        users = Collections.unmodifiableMap(next);
    }

    private User existing(String userId) {
        User user = userId == null ? null : users.get(userId);
        if (user == null) {
            throw LedgerException.notFound("user", userId);
        }
        return user;
    }

    private long activeAdminCount() {
        return users.values().stream().filter(u -> u.isAdmin() && u.isActive()).count();
    }

    private String newUserId() {
        String id;
        do {
            id = "U-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        } while (users.containsKey(id));
        return id;
    }

    private static void validate(Runnable validation) {
        try {
            validation.run();
        } catch (IllegalArgumentException e) {
            throw LedgerException.invalidInput(e.getMessage());
        }
    }

    private static String normalize(String username) {
        return username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String limitLabel(Integer limit) {
        return limit == null ? "default" : String.valueOf(limit);
    }

    /**
     * Consecutive login failures for one username.
     */
    private record LoginFailures(int count, Instant lockedUntil) {

        boolean isLocked(Instant now) {
            return lockedUntil != null && now.isBefore(lockedUntil);
        }

        boolean lockExpired(Instant now) {
            return lockedUntil != null && !now.isBefore(lockedUntil);
        }
    }
}
