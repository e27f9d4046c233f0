package in.equiptrack.infrastructure.metrics;

import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.equipment.EquipmentStatus;

import java.time.Duration;
import java.util.Map;

/**
 * Ledger metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Loans issued and returned
 * - Rejections by operation and error code
 * - Audit entries written
 * - Login outcomes
 * - Snapshot success rate and duration
 */
public interface LedgerMetrics {

    /**
     * Record one loan issued.
     */
    void recordLoanIssued();

    /**
     * Record a return.
     *
     * @param sentToMaintenance whether the equipment went to inspection
     */
    void recordLoanReturned(boolean sentToMaintenance);

    /**
     * Record a rejected operation.
     *
     * @param operation operation name (issue, return, register, ...)
     * @param code      rejection reason
     */
    void recordRejection(String operation, LedgerErrorCode code);

    /**
     * Record audit entries durably appended.
     */
    void recordAuditEntries(int count);

    void recordAuthentication(boolean success);

    /**
     * Record a snapshot attempt.
     *
     * @param success  whether the snapshot was durably written
     * @param duration time from capture to completion or failure
     */
    void recordSnapshot(boolean success, Duration duration);

    void recordRestore(boolean success);

    /**
     * Publish current equipment counts per status.
     */
    void updateInventory(Map<EquipmentStatus, Long> countsByStatus);

    LedgerMetrics NOOP = new LedgerMetrics() {
        @Override public void recordLoanIssued() {}
        @Override public void recordLoanReturned(boolean sentToMaintenance) {}
        @Override public void recordRejection(String operation, LedgerErrorCode code) {}
        @Override public void recordAuditEntries(int count) {}
        @Override public void recordAuthentication(boolean success) {}
        @Override public void recordSnapshot(boolean success, Duration duration) {}
        @Override public void recordRestore(boolean success) {}
        @Override public void updateInventory(Map<EquipmentStatus, Long> countsByStatus) {}
    };
}
