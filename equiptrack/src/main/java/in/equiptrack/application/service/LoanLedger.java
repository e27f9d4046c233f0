package in.equiptrack.application.service;

import in.equiptrack.config.LedgerConfig;
import in.equiptrack.domain.audit.AuditAction;
import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.audit.EntityType;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.equipment.EquipmentStatus;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.loan.LoanStatus;
import in.equiptrack.domain.user.Permission;
import in.equiptrack.domain.user.User;
import in.equiptrack.infrastructure.metrics.LedgerMetrics;
import in.equiptrack.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Loan Ledger.
 *
 * PURPOSE:
 * Issues and returns loans, enforcing equipment availability and per-supervisor limits.
 *
 * ATOMICITY:
 * Each issue or return is one {@link LedgerStore#write} call: the availability check, the
 * limit check, the new loan, the equipment transition and the audit entries either all
 * commit or none do. Two racing issues for the same equipment or the same last free slot
 * serialize on the writer lock, and the loser sees the winner's committed state.
 *
 * Limits are enforced only at issue time. Lowering a limit never touches existing loans.
 */
public final class LoanLedger {
    private static final Logger log = LoggerFactory.getLogger(LoanLedger.class);

    private final LedgerStore store;
    private final EquipmentRegistry registry;
    private final IdentityStore identity;
    private final InputValidator validator;
    private final LedgerConfig config;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public LoanLedger(LedgerStore store, EquipmentRegistry registry, IdentityStore identity,
                      InputValidator validator, LedgerConfig config, Clock clock, LedgerMetrics metrics) {
        this.store = store;
        this.registry = registry;
        this.identity = identity;
        this.validator = validator;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Issue a loan with no deployment location.
     *
     * @see #issue(String, String, String, String, String)
     */
    public String issue(String equipmentId, String supervisorId, String actorId) {
        return issue(equipmentId, supervisorId, actorId, null, null);
    }

    /**
     * Issue a loan of one equipment item to a supervisor.
     *
     * @param location where the equipment is deployed; updates the equipment's location when given
     * @param notes    free-text notes stored on the loan
     * @return the new loan id
     * @throws LedgerException UNAUTHORIZED, NOT_FOUND, EQUIPMENT_UNAVAILABLE or LIMIT_EXCEEDED
     */
    public String issue(String equipmentId, String supervisorId, String actorId, String location, String notes) {
        return issueAll(List.of(equipmentId), supervisorId, actorId, location, notes).get(0);
    }

    /**
     * Issue several items to one supervisor as a single all-or-nothing unit.
     * The limit check counts the whole batch.
     *
     * @return loan ids in the order of {@code equipmentIds}
     */
    public List<String> issueAll(List<String> equipmentIds, String supervisorId, String actorId,
                                 String location, String notes) {
        return tracked("issue", () -> {
            identity.require(actorId, Permission.ISSUE_LOAN);
            if (equipmentIds == null || equipmentIds.isEmpty()) {
                throw LedgerException.invalidInput("at least one equipment id is required");
            }
            if (new LinkedHashSet<>(equipmentIds).size() != equipmentIds.size()) {
                throw LedgerException.invalidInput("duplicate equipment id in request");
            }
            validateText("location", location);
            validateText("notes", notes);

            List<String> loanIds = store.write(tx -> {
                User supervisor = activeSupervisor(supervisorId);
                int limit = supervisor.effectiveLoanLimit(config.defaultLoanLimit());

                List<String> issued = new ArrayList<>(equipmentIds.size());
                for (String equipmentId : equipmentIds) {
                    Equipment equipment = tx.equipment(equipmentId)
                        .orElseThrow(() -> LedgerException.notFound("equipment", equipmentId));
                    if (!equipment.isAvailable()) {
                        throw new LedgerException(LedgerErrorCode.EQUIPMENT_UNAVAILABLE,
                            equipmentId + " is " + equipment.status());
                    }
                    int open = tx.openLoanCount(supervisorId);
                    if (open >= limit) {
                        throw new LedgerException(LedgerErrorCode.LIMIT_EXCEEDED,
                            supervisorId + " holds " + open + " of " + limit);
                    }

                    Instant now = clock.instant();
                    Loan loan = new Loan(newLoanId(tx), equipmentId, supervisorId, now,
                        now.plus(config.loanPeriod()), null, actorId, null, blankToNull(location), blankToNull(notes));

                    Equipment loaned = registry.applyTransition(tx, equipment, EquipmentStatus.LOANED, actorId,
                        "loan=" + loan.loanId());
                    if (loan.location() != null) {
                        tx.put(loaned.withLocation(loan.location(), now));
                    }
                    tx.put(loan);
                    tx.audit(AuditDraft.of(actorId, AuditAction.LOAN_ISSUED, EntityType.LOAN, loan.loanId(),
                        null, LoanStatus.OPEN.name())
                        .withDetails("equipment=" + equipmentId + ", supervisor=" + supervisorId
                            + ", due=" + loan.dueAt()));
                    issued.add(loan.loanId());
                }
                return issued;
            });

            for (int i = 0; i < loanIds.size(); i++) {
                metrics.recordLoanIssued();
                log.info("Loan issued: {} equipment={} supervisor={} by {}",
                    loanIds.get(i), equipmentIds.get(i), supervisorId, actorId);
            }
            return loanIds;
        });
    }

    /**
     * Return a loan; the equipment becomes AVAILABLE.
     *
     * @see #returnLoan(String, String, boolean)
     */
    public Loan returnLoan(String loanId, String actorId) {
        return returnLoan(loanId, actorId, false);
    }

    /**
     * Close a loan.
     *
     * @param sendToMaintenance when true the equipment goes to MAINTENANCE for inspection
     * @return the closed loan
     * @throws LedgerException NOT_FOUND or ALREADY_RETURNED; a repeated return changes nothing
     */
    public Loan returnLoan(String loanId, String actorId, boolean sendToMaintenance) {
        return tracked("return", () -> {
            identity.require(actorId, Permission.RETURN_LOAN);

            Loan closed = store.write(tx -> {
                Loan loan = tx.loan(loanId).orElseThrow(() -> LedgerException.notFound("loan", loanId));
                if (loan.isReturned()) {
                    throw new LedgerException(LedgerErrorCode.ALREADY_RETURNED, loanId);
                }
                Equipment equipment = tx.equipment(loan.equipmentId())
                    .orElseThrow(() -> LedgerException.notFound("equipment", loan.equipmentId()));

                Instant now = clock.instant();
                Loan returned = loan.returned(now, actorId);
                tx.put(returned);

                Equipment available = registry.applyTransition(tx, equipment, EquipmentStatus.AVAILABLE, actorId,
                    "loan=" + loanId);
                Equipment result = sendToMaintenance
                    ? registry.applyTransition(tx, available, EquipmentStatus.MAINTENANCE, actorId,
                        "inspection after loan=" + loanId)
                    : available;
                if (config.returnLocation() != null) {
                    tx.put(result.withLocation(config.returnLocation(), now));
                }

                tx.audit(AuditDraft.of(actorId, AuditAction.LOAN_RETURNED, EntityType.LOAN, loanId,
                    loan.effectiveStatus(now).name(), LoanStatus.RETURNED.name())
                    .withDetails("equipment=" + loan.equipmentId() + (sendToMaintenance ? ", inspection" : "")));
                return returned;
            });

            metrics.recordLoanReturned(sendToMaintenance);
            log.info("Loan returned: {} equipment={} inspection={} by {}",
                loanId, closed.equipmentId(), sendToMaintenance, actorId);
            return closed;
        });
    }

    /**
     * Effective status at the current clock instant.
     */
    public LoanStatus effectiveStatus(Loan loan) {
        return loan.effectiveStatus(clock.instant());
    }

    /**
     * @throws LedgerException NOT_FOUND
     */
    public Loan lookup(String loanId) {
        return store.current().loan(loanId).orElseThrow(() -> LedgerException.notFound("loan", loanId));
    }

    /**
     * Non-returned loans of a supervisor ordered by issue time.
     */
    public List<Loan> openLoansFor(String supervisorId) {
        return store.current().openLoansFor(supervisorId);
    }

    /**
     * All non-returned loans ordered by issue time.
     */
    public List<Loan> openLoans() {
        return store.current().openLoans().stream()
            .sorted(Comparator.comparing(Loan::issuedAt).thenComparing(Loan::loanId))
            .toList();
    }

    /**
     * Overdue loans, oldest due date first.
     */
    public List<Loan> overdueLoans() {
        Instant now = clock.instant();
        return store.current().openLoans().stream()
            .filter(l -> l.effectiveStatus(now) == LoanStatus.OVERDUE)
            .sorted(Comparator.comparing(Loan::dueAt).thenComparing(Loan::loanId))
            .toList();
    }

    /**
     * Every loan ever made for an equipment item, oldest first.
     */
    public List<Loan> historyFor(String equipmentId) {
        return store.current().allLoans().stream()
            .filter(l -> l.equipmentId().equals(equipmentId))
            .sorted(Comparator.comparing(Loan::issuedAt).thenComparing(Loan::loanId))
            .toList();
    }

    private User activeSupervisor(String supervisorId) {
        User supervisor = identity.find(supervisorId)
            .orElseThrow(() -> LedgerException.notFound("supervisor", supervisorId));
        if (!supervisor.isSupervisor() || !supervisor.isActive()) {
            throw LedgerException.invalidInput(supervisorId + " is not an active supervisor");
        }
        return supervisor;
    }

    private void validateText(String field, String value) {
        if (!validator.isSafeText(value, false)) {
            throw LedgerException.invalidInput(field + " contains invalid content");
        }
    }

    private <T> T tracked(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (LedgerException e) {
            metrics.recordRejection(operation, e.getCode());
            throw e;
        }
    }

    private static String newLoanId(LedgerTransaction tx) {
        String id;
        do {
            id = "LN-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        } while (tx.loan(id).isPresent());
        return id;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
