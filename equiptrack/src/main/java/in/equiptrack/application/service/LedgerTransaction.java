package in.equiptrack.application.service;

import in.equiptrack.domain.audit.AuditDraft;
import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.loan.Loan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working copy for one ledger mutation.
 *
 * Reads see the base state overlaid with this transaction's own pending writes. Nothing
 * is visible to other threads until {@link LedgerStore} commits it; a transaction
 * abandoned by an exception leaves no trace.
 */
public final class LedgerTransaction {

    private final LedgerState base;
    private final Map<String, Equipment> pendingEquipment = new LinkedHashMap<>();
    private final Map<String, Loan> pendingLoans = new LinkedHashMap<>();
    private final List<AuditDraft> auditDrafts = new ArrayList<>();

    LedgerTransaction(LedgerState base) {
        this.base = base;
    }

    public Optional<Equipment> equipment(String equipmentId) {
        Equipment pending = pendingEquipment.get(equipmentId);
        return pending != null ? Optional.of(pending) : base.equipment(equipmentId);
    }

    public Optional<Equipment> equipmentByCode(String code) {
        for (Equipment e : pendingEquipment.values()) {
            if (e.code().equals(code)) {
                return Optional.of(e);
            }
        }
        return base.equipmentByCode(code);
    }

    public Optional<Loan> loan(String loanId) {
        Loan pending = pendingLoans.get(loanId);
        return pending != null ? Optional.of(pending) : base.loan(loanId);
    }

    /**
     * Open loan count for a supervisor, including loans issued or returned in this transaction.
     */
    public int openLoanCount(String supervisorId) {
        Set<String> open = new HashSet<>();
        for (Loan l : base.openLoansFor(supervisorId)) {
            open.add(l.loanId());
        }
        for (Loan l : pendingLoans.values()) {
            if (!l.supervisorId().equals(supervisorId)) {
                continue;
            }
            if (l.isReturned()) {
                open.remove(l.loanId());
            } else {
                open.add(l.loanId());
            }
        }
        return open.size();
    }

    public void put(Equipment equipment) {
        pendingEquipment.put(equipment.equipmentId(), equipment);
    }

    public void put(Loan loan) {
        pendingLoans.put(loan.loanId(), loan);
    }

    public void audit(AuditDraft draft) {
        auditDrafts.add(draft);
    }

    boolean isEmpty() {
        return pendingEquipment.isEmpty() && pendingLoans.isEmpty() && auditDrafts.isEmpty();
    }

    /**
     * Storage batch holding new record versions, the versions they replace, and the audit drafts.
     */
    RecordBatch toBatch() {
        RecordBatch batch = new RecordBatch();
        for (Equipment e : pendingEquipment.values()) {
            batch.put(LedgerStore.equipmentKey(e.equipmentId()), e, base.equipment(e.equipmentId()).orElse(null));
        }
        for (Loan l : pendingLoans.values()) {
            batch.put(LedgerStore.loanKey(l.loanId()), l, base.loan(l.loanId()).orElse(null));
        }
        auditDrafts.forEach(batch::audit);
        return batch;
    }

    LedgerState applyTo(LedgerState state) {
        return state.with(pendingEquipment.values(), pendingLoans.values());
    }
}
