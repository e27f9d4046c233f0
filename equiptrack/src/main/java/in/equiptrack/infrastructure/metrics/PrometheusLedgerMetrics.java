package in.equiptrack.infrastructure.metrics;

import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.equipment.EquipmentStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Map;

/**
 * Prometheus implementation of LedgerMetrics.
 *
 * Key Metrics:
 * - ledger_loans_issued_total - Loans issued
 * - ledger_loans_returned_total{outcome} - Returns (available | maintenance)
 * - ledger_rejections_total{operation, code} - Rejected operations
 * - ledger_audit_entries_total - Audit entries written
 * - ledger_authentications_total{status} - Login outcomes
 * - ledger_snapshots_total{result} - Snapshot outcomes
 * - ledger_snapshot_duration_seconds - Snapshot latency distribution
 * - ledger_restores_total{result} - Restore outcomes
 * - ledger_equipment{status} - Current equipment per status
 *
 * Usage:
 * <pre>
 * PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics(new CollectorRegistry());
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusLedgerMetrics implements LedgerMetrics {

    private final CollectorRegistry registry;

    private final Counter loansIssued;
    private final Counter loansReturned;
    private final Counter rejections;
    private final Counter auditEntries;
    private final Counter authentications;
    private final Counter snapshots;
    private final Histogram snapshotDuration;
    private final Counter restores;
    private final Gauge equipmentByStatus;

    public PrometheusLedgerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLedgerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.loansIssued = Counter.build()
            .name("ledger_loans_issued_total")
            .help("Total number of loans issued")
            .register(registry);

        this.loansReturned = Counter.build()
            .name("ledger_loans_returned_total")
            .help("Total number of loans returned")
            .labelNames("outcome")
            .register(registry);

        this.rejections = Counter.build()
            .name("ledger_rejections_total")
            .help("Total number of rejected ledger operations")
            .labelNames("operation", "code")
            .register(registry);

        this.auditEntries = Counter.build()
            .name("ledger_audit_entries_total")
            .help("Total number of audit entries written")
            .register(registry);

        this.authentications = Counter.build()
            .name("ledger_authentications_total")
            .help("Total number of authentication attempts")
            .labelNames("status")
            .register(registry);

        this.snapshots = Counter.build()
            .name("ledger_snapshots_total")
            .help("Total number of snapshot attempts")
            .labelNames("result")
            .register(registry);

        this.snapshotDuration = Histogram.build()
            .name("ledger_snapshot_duration_seconds")
            .help("Snapshot duration in seconds")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 30.0)
            .register(registry);

        this.restores = Counter.build()
            .name("ledger_restores_total")
            .help("Total number of restore attempts")
            .labelNames("result")
            .register(registry);

        this.equipmentByStatus = Gauge.build()
            .name("ledger_equipment")
            .help("Current number of equipment items per status")
            .labelNames("status")
            .register(registry);
    }

    @Override
    public void recordLoanIssued() {
        loansIssued.inc();
    }

    @Override
    public void recordLoanReturned(boolean sentToMaintenance) {
        loansReturned.labels(sentToMaintenance ? "maintenance" : "available").inc();
    }

    @Override
    public void recordRejection(String operation, LedgerErrorCode code) {
        rejections.labels(operation, code.name()).inc();
    }

    @Override
    public void recordAuditEntries(int count) {
        auditEntries.inc(count);
    }

    @Override
    public void recordAuthentication(boolean success) {
        authentications.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordSnapshot(boolean success, Duration duration) {
        snapshots.labels(success ? "success" : "failure").inc();
        snapshotDuration.observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordRestore(boolean success) {
        restores.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void updateInventory(Map<EquipmentStatus, Long> countsByStatus) {
        for (EquipmentStatus status : EquipmentStatus.values()) {
            equipmentByStatus.labels(status.name()).set(countsByStatus.getOrDefault(status, 0L));
        }
    }

    /**
     * Get Prometheus registry for exposing metrics.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
