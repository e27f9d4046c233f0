package in.equiptrack.bootstrap;

import in.equiptrack.application.port.output.CredentialHasher;
import in.equiptrack.application.port.output.LedgerStorage;
import in.equiptrack.application.service.AuditTrail;
import in.equiptrack.application.service.EquipmentRegistry;
import in.equiptrack.application.service.IdentityStore;
import in.equiptrack.application.service.LedgerStatisticsService;
import in.equiptrack.application.service.LedgerStore;
import in.equiptrack.application.service.LoanLedger;
import in.equiptrack.application.service.SnapshotCoordinator;
import in.equiptrack.config.LedgerConfig;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the ledger components over one storage engine and loads persisted state.
 *
 * Load order is audit, then users, then equipment and loans, so the audit sequence is
 * known before any component can append.
 */
public final class LedgerEngine {
    private static final Logger log = LoggerFactory.getLogger(LedgerEngine.class);

    private final AuditTrail auditTrail;
    private final IdentityStore identity;
    private final LedgerStore ledgerStore;
    private final EquipmentRegistry registry;
    private final LoanLedger loans;
    private final SnapshotCoordinator snapshots;
    private final LedgerStatisticsService statistics;

    public LedgerEngine(LedgerStorage storage, CredentialHasher hasher, LedgerConfig config,
                        Clock clock, LedgerMetrics metrics) {
        InputValidator validator = new InputValidator(config.codePattern());
        this.auditTrail = new AuditTrail(storage, clock, metrics);
        this.identity = new IdentityStore(storage, auditTrail, hasher, validator, config, clock, metrics);
        this.ledgerStore = new LedgerStore(storage, auditTrail);
        this.registry = new EquipmentRegistry(ledgerStore, identity, validator, clock, metrics);
        this.loans = new LoanLedger(ledgerStore, registry, identity, validator, config, clock, metrics);
        this.snapshots = new SnapshotCoordinator(ledgerStore, identity, auditTrail, storage, config, clock, metrics);
        this.statistics = new LedgerStatisticsService(ledgerStore, identity, auditTrail, config, clock, metrics);

        auditTrail.load();
        identity.load();
        ledgerStore.load();
        log.info("Ledger engine ready: {} users, {} equipment, {} loans, {} audit entries",
            identity.listUsers().size(), ledgerStore.current().equipmentCount(),
            ledgerStore.current().loanCount(), auditTrail.size());
    }

    public AuditTrail auditTrail() {
        return auditTrail;
    }

    public IdentityStore identity() {
        return identity;
    }

    public EquipmentRegistry registry() {
        return registry;
    }

    public LoanLedger loans() {
        return loans;
    }

    public SnapshotCoordinator snapshots() {
        return snapshots;
    }

    public LedgerStatisticsService statistics() {
        return statistics;
    }
}
