package in.equiptrack.domain.stats;

import in.equiptrack.domain.equipment.EquipmentStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Inventory overview.
 *
 * @param utilization loaned items divided by non-retired items, 0 when there are none
 */
public record DashboardStats(
    int totalEquipment,
    Map<EquipmentStatus, Long> countsByStatus,
    int openLoans,
    int overdueLoans,
    int longRunningLoans,
    double utilization,
    Instant generatedAt
) {}
