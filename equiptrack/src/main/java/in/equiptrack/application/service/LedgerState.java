package in.equiptrack.application.service;

import in.equiptrack.domain.equipment.Equipment;
import in.equiptrack.domain.loan.Loan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of equipment and loans at one commit point.
 *
 * A new instance is published after every successful commit, so readers holding a
 * reference always see equipment and loans that agree with each other.
 */
public final class LedgerState {

    private static final LedgerState EMPTY = new LedgerState(List.of(), List.of());

    private final Map<String, Equipment> equipment;
    private final Map<String, String> equipmentIdByCode;
    private final Map<String, Loan> loans;
    private final Map<String, Loan> openLoanByEquipment;
    private final Map<String, List<Loan>> openLoansBySupervisor;

    private LedgerState(Collection<Equipment> equipmentItems, Collection<Loan> loanItems) {
        TreeMap<String, Equipment> byId = new TreeMap<>();
        Map<String, String> byCode = new HashMap<>();
        for (Equipment e : equipmentItems) {
            byId.put(e.equipmentId(), e);
            byCode.put(e.code(), e.equipmentId());
        }

        TreeMap<String, Loan> loansById = new TreeMap<>();
        Map<String, Loan> openByEquipment = new HashMap<>();
        Map<String, List<Loan>> openBySupervisor = new HashMap<>();
        for (Loan l : loanItems) {
            loansById.put(l.loanId(), l);
            if (!l.isReturned()) {
                openByEquipment.put(l.equipmentId(), l);
                openBySupervisor.computeIfAbsent(l.supervisorId(), k -> new ArrayList<>()).add(l);
            }
        }
        for (List<Loan> list : openBySupervisor.values()) {
            list.sort(Comparator.comparing(Loan::issuedAt).thenComparing(Loan::loanId));
        }
        openBySupervisor.replaceAll((k, v) -> List.copyOf(v));

        this.equipment = Collections.unmodifiableMap(byId);
        this.equipmentIdByCode = Collections.unmodifiableMap(byCode);
        this.loans = Collections.unmodifiableMap(loansById);
        this.openLoanByEquipment = Collections.unmodifiableMap(openByEquipment);
        this.openLoansBySupervisor = Collections.unmodifiableMap(openBySupervisor);
    }

    public static LedgerState empty() {
        return EMPTY;
    }

    public static LedgerState of(Collection<Equipment> equipment, Collection<Loan> loans) {
        return new LedgerState(equipment, loans);
    }

    /**
     * New state with the given records added or replaced.
     */
    LedgerState with(Collection<Equipment> changedEquipment, Collection<Loan> changedLoans) {
        Map<String, Equipment> nextEquipment = new TreeMap<>(equipment);
        for (Equipment e : changedEquipment) {
            nextEquipment.put(e.equipmentId(), e);
        }
        Map<String, Loan> nextLoans = new TreeMap<>(loans);
        for (Loan l : changedLoans) {
            nextLoans.put(l.loanId(), l);
        }
        return new LedgerState(nextEquipment.values(), nextLoans.values());
    }

    public Optional<Equipment> equipment(String equipmentId) {
        return Optional.ofNullable(equipmentId == null ? null : equipment.get(equipmentId));
    }

    public Optional<Equipment> equipmentByCode(String code) {
        String id = code == null ? null : equipmentIdByCode.get(code);
        return id == null ? Optional.empty() : Optional.ofNullable(equipment.get(id));
    }

    /**
     * All equipment ordered by id.
     */
    public Collection<Equipment> allEquipment() {
        return equipment.values();
    }

    public Optional<Loan> loan(String loanId) {
        return Optional.ofNullable(loanId == null ? null : loans.get(loanId));
    }

    /**
     * All loans ordered by id.
     */
    public Collection<Loan> allLoans() {
        return loans.values();
    }

    public Optional<Loan> openLoanFor(String equipmentId) {
        return Optional.ofNullable(openLoanByEquipment.get(equipmentId));
    }

    /**
     * Non-returned loans of a supervisor ordered by issue time.
     */
    public List<Loan> openLoansFor(String supervisorId) {
        return openLoansBySupervisor.getOrDefault(supervisorId, List.of());
    }

    public Collection<Loan> openLoans() {
        return openLoanByEquipment.values();
    }

    public int equipmentCount() {
        return equipment.size();
    }

    public int loanCount() {
        return loans.size();
    }
}
