package in.equiptrack.application.service;

import in.equiptrack.config.LedgerConfig;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.audit.AuditQuery;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.equipment.EquipmentStatus;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.loan.LoanStatus;
import in.equiptrack.domain.stats.DashboardStats;
import in.equiptrack.domain.stats.SupervisorLoanSummary;
import in.equiptrack.domain.user.User;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only aggregations over the published ledger state and the audit trail.
 *
 * Every call recomputes from the current snapshot reference; nothing is cached and no
 * lock is taken.
 */
public final class LedgerStatisticsService {

    private final LedgerStore store;
    private final IdentityStore identity;
    private final AuditTrail auditTrail;
    private final LedgerConfig config;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public LedgerStatisticsService(LedgerStore store, IdentityStore identity, AuditTrail auditTrail,
                                   LedgerConfig config, Clock clock, LedgerMetrics metrics) {
        this.store = store;
        this.identity = identity;
        this.auditTrail = auditTrail;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Equipment count for every status, zero included. Also refreshes the inventory gauge.
     */
    public Map<EquipmentStatus, Long> equipmentCountsByStatus() {
        Map<EquipmentStatus, Long> counts = countByStatus(store.current());
        metrics.updateInventory(counts);
        return counts;
    }

    /**
     * Equipment count per category, ordered by category name.
     */
    public Map<String, Long> equipmentCountsByCategory() {
        Map<String, Long> counts = new TreeMap<>();
        for (Equipment e : store.current().allEquipment()) {
            counts.merge(e.category(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    /**
     * One summary per supervisor account, plus one for any other account that still holds
     * open loans (for example after a role change), ordered by username. Accounts that are
     * no longer supervisors report a limit of zero. The open counts add up to the dashboard's
     * open loan total.
     */
    public List<SupervisorLoanSummary> supervisorLoanSummaries() {
        LedgerState state = store.current();
        Instant now = clock.instant();

        Map<String, User> holders = new LinkedHashMap<>();
        for (User supervisor : identity.supervisors(null)) {
            holders.put(supervisor.userId(), supervisor);
        }
        Set<String> orphans = new TreeSet<>();
        for (Loan loan : state.openLoans()) {
            String holderId = loan.supervisorId();
            if (!holders.containsKey(holderId)) {
                identity.find(holderId).ifPresentOrElse(u -> holders.put(holderId, u), () -> orphans.add(holderId));
            }
        }

        List<SupervisorLoanSummary> summaries = new ArrayList<>();
        for (User holder : holders.values()) {
            int limit = holder.isSupervisor() ? holder.effectiveLoanLimit(config.defaultLoanLimit()) : 0;
            summaries.add(summarize(state.openLoansFor(holder.userId()), now, holder.userId(), holder.username(),
                holder.displayName(), holder.department(), limit));
        }
        for (String orphanId : orphans) {
            summaries.add(summarize(state.openLoansFor(orphanId), now, orphanId, orphanId, null, null, 0));
        }
        summaries.sort(Comparator.comparing(SupervisorLoanSummary::username));
        return summaries;
    }

    private static SupervisorLoanSummary summarize(List<Loan> open, Instant now, String userId, String username,
                                                   String displayName, String department, int limit) {
        int overdue = (int) open.stream().filter(l -> l.effectiveStatus(now) == LoanStatus.OVERDUE).count();
        return new SupervisorLoanSummary(userId, username, displayName, department, open.size(), overdue, limit,
            Math.max(0, limit - open.size()));
    }

    /**
     * Audit entries with timestamps in {@code [now - window, now]}.
     */
    public List<AuditEntry> recentActivity(Duration window) {
        Instant now = clock.instant();
        return auditTrail.query(AuditQuery.between(now.minus(window), now)).toList();
    }

    /**
     * Open loans issued longer ago than the overdue alert threshold, oldest first.
     */
    public List<Loan> longRunningLoans() {
        return longRunning(store.current(), clock.instant());
    }

    public DashboardStats dashboard() {
        LedgerState state = store.current();
        Instant now = clock.instant();
        Map<EquipmentStatus, Long> counts = countByStatus(state);
        metrics.updateInventory(counts);

        int overdue = (int) state.openLoans().stream()
            .filter(l -> l.effectiveStatus(now) == LoanStatus.OVERDUE)
            .count();
        long inService = state.equipmentCount() - counts.get(EquipmentStatus.RETIRED);
        double utilization = inService == 0 ? 0.0 : (double) counts.get(EquipmentStatus.LOANED) / inService;

        return new DashboardStats(state.equipmentCount(), counts, state.openLoans().size(), overdue,
            longRunning(state, now).size(), utilization, now);
    }

    private List<Loan> longRunning(LedgerState state, Instant now) {
        Instant cutoff = now.minus(config.overdueAlertThreshold());
        return state.openLoans().stream()
            .filter(l -> l.issuedAt().isBefore(cutoff))
            .sorted(Comparator.comparing(Loan::issuedAt).thenComparing(Loan::loanId))
            .toList();
    }

    private static Map<EquipmentStatus, Long> countByStatus(LedgerState state) {
        Map<EquipmentStatus, Long> counts = new EnumMap<>(EquipmentStatus.class);
        for (EquipmentStatus status : EquipmentStatus.values()) {
            counts.put(status, 0L);
        }
        for (Equipment e : state.allEquipment()) {
            counts.merge(e.status(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
