package in.equiptrack.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.auth.SaltedSha256CredentialHasher;
import in.equiptrack.auth.SessionTokenService;
import in.equiptrack.config.LedgerConfig;
import in.equiptrack.infrastructure.metrics.PrometheusLedgerMetrics;
import in.equiptrack.infrastructure.metrics.PrometheusMetricsHandler;
import in.equiptrack.infrastructure.persistence.FileLedgerStorage;
import in.equiptrack.infrastructure.persistence.InMemoryLedgerStorage;
import in.equiptrack.infrastructure.persistence.PostgresLedgerStorage;
import in.equiptrack.transport.http.LedgerApiHandlers;
import in.equiptrack.util.Env;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Core Java entry point (NO Spring).
 *
 * Reads configuration from the environment, validates it, loads the ledger from the
 * selected storage engine and serves the JSON API on Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== EquipTrack Ledger Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        LedgerConfig config = LedgerConfig.fromEnv();
        StartupConfigValidator.validate(config);

        int port = Env.getInt("PORT", 9090);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        StorageMode mode = StorageMode.parse(Env.get("STORAGE_MODE", "MEMORY"));
        HikariDataSource dataSource = mode == StorageMode.POSTGRES ? createDataSource() : null;
        LedgerStorage storage = createStorage(mode, dataSource);
        log.info("✓ Storage engine: {}", mode);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Ledger components
        // ═══════════════════════════════════════════════════════════════
        LedgerEngine engine = new LedgerEngine(storage, new SaltedSha256CredentialHasher(), config, clock, metrics);
        ensureAdminExists(engine);
        engine.statistics().equipmentCountsByStatus();

        SessionTokenService tokens = new SessionTokenService(
            Env.get("SESSION_SECRET", StartupConfigValidator.DEFAULT_SESSION_SECRET),
            config.sessionTimeout(), clock);

        ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SessionHousekeeping");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleWithFixedDelay(() -> {
            int purged = tokens.purgeRevoked();
            if (purged > 0) {
                log.debug("Purged {} expired revoked sessions", purged);
            }
        }, 5, 5, TimeUnit.MINUTES);

        engine.snapshots().start();

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        LedgerApiHandlers api = new LedgerApiHandlers(tokens, engine.identity(), engine.registry(),
            engine.loans(), engine.statistics(), engine.auditTrail(), engine.snapshots());

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(api.routes(new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            engine.snapshots().stop();
            housekeeping.shutdownNow();
            if (dataSource != null) {
                dataSource.close();
            }
        }, "ShutdownHook"));

        log.info("✓ EquipTrack Ledger started on http://localhost:{}/", port);
    }

    private static LedgerStorage createStorage(StorageMode mode, DataSource dataSource) {
        return switch (mode) {
            case MEMORY -> new InMemoryLedgerStorage();
            case FILE -> new FileLedgerStorage(Paths.get(Env.get("DATA_DIR", "./data")));
            case POSTGRES -> {
                PostgresLedgerStorage postgres = new PostgresLedgerStorage(dataSource);
                postgres.initSchema();
                yield postgres;
            }
        };
    }

    private static void ensureAdminExists(LedgerEngine engine) {
        String username = Env.get("ADMIN_USERNAME", "admin");
        String password = Env.get("ADMIN_PASSWORD", StartupConfigValidator.DEFAULT_ADMIN_PASSWORD);
        engine.identity().bootstrapAdmin(username, password).ifPresentOrElse(
            admin -> log.info("Admin user created: {} ({})", admin.username(), admin.userId()),
            () -> log.info("Admin user already exists"));
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/equiptrack");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setAutoCommit(true);
        config.setPoolName("equiptrack-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
