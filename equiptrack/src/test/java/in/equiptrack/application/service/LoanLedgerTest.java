package in.equiptrack.application.service;

import in.equiptrack.domain.audit.AuditAction;
import in.equiptrack.domain.audit.AuditEntry;
import in.equiptrack.domain.audit.AuditQuery;
import in.equiptrack.domain.common.LedgerErrorCode;
import in.equiptrack.domain.common.LedgerException;
import in.equiptrack.domain.equipment.EquipmentStatus;
import in.equiptrack.domain.loan.Loan;
import in.equiptrack.domain.loan.LoanStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Loan Ledger")
class LoanLedgerTest {

    private LedgerFixture fx;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
    }

    @AfterEach
    void tearDown() {
        fx.stop();
    }

    @Test
    @DisplayName("Issuing marks equipment LOANED; a second issue of the same item is rejected")
    void issueThenSecondIssueIsUnavailable() {
        String s1 = fx.supervisor(1);
        String s2 = fx.supervisor(1);
        String e1 = fx.equipment("QR-0001");

        String loanId = fx.loans.issue(e1, s1, s1);

        assertEquals(EquipmentStatus.LOANED, fx.registry.lookup(e1).status());
        Loan loan = fx.loans.lookup(loanId);
        assertEquals(s1, loan.supervisorId());
        assertEquals(LoanStatus.OPEN, fx.loans.effectiveStatus(loan));

        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e1, s2, s2));
        assertEquals(LedgerErrorCode.EQUIPMENT_UNAVAILABLE, ex.getCode());
        assertTrue(fx.loans.openLoansFor(s2).isEmpty());
    }

    @Test
    @DisplayName("A supervisor at their limit cannot take another item")
    void limitExceeded() {
        String s1 = fx.supervisor(1);
        String e1 = fx.equipment("QR-0001");
        String e2 = fx.equipment("QR-0002");
        fx.loans.issue(e1, s1, s1);

        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e2, s1, s1));

        assertEquals(LedgerErrorCode.LIMIT_EXCEEDED, ex.getCode());
        assertEquals(EquipmentStatus.AVAILABLE, fx.registry.lookup(e2).status());
        assertEquals(1, fx.loans.openLoansFor(s1).size());
    }

    @Test
    @DisplayName("Supervisors without an individual limit use the configured default")
    void defaultLimitApplies() {
        String s1 = fx.supervisor();
        fx.loans.issue(fx.equipment("QR-0001"), s1, s1);
        fx.loans.issue(fx.equipment("QR-0002"), s1, s1);

        String e3 = fx.equipment("QR-0003");
        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e3, s1, s1));
        assertEquals(LedgerErrorCode.LIMIT_EXCEEDED, ex.getCode());
    }

    @Test
    @DisplayName("Overdue is derived from due date and the current clock")
    void overdueIsDerivedAtReadTime() {
        String s1 = fx.supervisor();
        String loanId = fx.loans.issue(fx.equipment("QR-0001"), s1, s1);
        Loan loan = fx.loans.lookup(loanId);
        assertEquals(loan.issuedAt().plus(Duration.ofDays(7)), loan.dueAt());

        fx.clock.advance(Duration.ofDays(6));
        assertTrue(fx.loans.overdueLoans().isEmpty());
        assertEquals(LoanStatus.OPEN, fx.loans.effectiveStatus(loan));

        fx.clock.advance(Duration.ofDays(2));
        List<Loan> overdue = fx.loans.overdueLoans();
        assertEquals(1, overdue.size());
        assertEquals(loanId, overdue.get(0).loanId());
        assertEquals(LoanStatus.OVERDUE, fx.loans.effectiveStatus(overdue.get(0)));
    }

    @Test
    @DisplayName("Returning twice fails the second time and changes nothing")
    void returnIsNotRepeatable() {
        String s1 = fx.supervisor();
        String e1 = fx.equipment("QR-0001");
        String loanId = fx.loans.issue(e1, s1, s1);
        fx.clock.advance(Duration.ofHours(3));

        Loan returned = fx.loans.returnLoan(loanId, s1);
        assertEquals(fx.clock.instant(), returned.returnedAt());
        assertEquals(EquipmentStatus.AVAILABLE, fx.registry.lookup(e1).status());

        int auditBefore = fx.auditTrail.size();
        LedgerState stateBefore = fx.ledgerStore.current();

        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.returnLoan(loanId, s1));

        assertEquals(LedgerErrorCode.ALREADY_RETURNED, ex.getCode());
        assertSame(stateBefore, fx.ledgerStore.current());
        assertEquals(auditBefore, fx.auditTrail.size());
    }

    @Test
    @DisplayName("Returning for inspection leaves the item in MAINTENANCE with both transitions audited")
    void returnForInspection() {
        String s1 = fx.supervisor();
        String e1 = fx.equipment("QR-0001");
        String loanId = fx.loans.issue(e1, s1, s1);

        fx.loans.returnLoan(loanId, s1, true);

        assertEquals(EquipmentStatus.MAINTENANCE, fx.registry.lookup(e1).status());
        List<AuditEntry> transitions = fx.auditTrail.query(AuditQuery.forEntity(e1))
            .filter(a -> a.action() == AuditAction.EQUIPMENT_TRANSITIONED)
            .toList();
        assertEquals(3, transitions.size());
        assertEquals("LOANED", transitions.get(1).beforeStatus());
        assertEquals("AVAILABLE", transitions.get(1).afterStatus());
        assertEquals("AVAILABLE", transitions.get(2).beforeStatus());
        assertEquals("MAINTENANCE", transitions.get(2).afterStatus());
    }

    @Test
    @DisplayName("Configured return location is applied on return")
    void returnLocationApplied() {
        fx.stop();
        fx = new LedgerFixture(LedgerFixture.defaultConfig().withReturnLocation("Store Room"));
        String s1 = fx.supervisor();
        String e1 = fx.equipment("QR-0001");
        String loanId = fx.loans.issue(e1, s1, s1, "Site 7", null);
        assertEquals("Site 7", fx.registry.lookup(e1).location());

        fx.loans.returnLoan(loanId, s1);

        assertEquals("Store Room", fx.registry.lookup(e1).location());
    }

    @Test
    @DisplayName("Lowering a limit keeps existing loans but blocks new ones")
    void loweredLimitIsNotRetroactive() {
        String s1 = fx.supervisor(3);
        fx.loans.issue(fx.equipment("QR-0001"), s1, s1);
        fx.loans.issue(fx.equipment("QR-0002"), s1, s1);

        fx.identity.setLoanLimit(s1, 1, fx.adminId);

        assertEquals(2, fx.loans.openLoansFor(s1).size());
        String e3 = fx.equipment("QR-0003");
        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e3, s1, s1));
        assertEquals(LedgerErrorCode.LIMIT_EXCEEDED, ex.getCode());
    }

    @Test
    @DisplayName("Batch issue is all-or-nothing")
    void batchIssueIsAtomic() {
        String s1 = fx.supervisor(2);
        String e1 = fx.equipment("QR-0001");
        String e2 = fx.equipment("QR-0002");
        String e3 = fx.equipment("QR-0003");

        LedgerException ex = assertThrows(LedgerException.class,
            () -> fx.loans.issueAll(List.of(e1, e2, e3), s1, s1, null, null));

        assertEquals(LedgerErrorCode.LIMIT_EXCEEDED, ex.getCode());
        assertTrue(fx.loans.openLoansFor(s1).isEmpty());
        assertEquals(EquipmentStatus.AVAILABLE, fx.registry.lookup(e1).status());
        assertEquals(EquipmentStatus.AVAILABLE, fx.registry.lookup(e2).status());

        List<String> loanIds = fx.loans.issueAll(List.of(e1, e2), s1, s1, null, null);
        assertEquals(2, loanIds.size());
        assertEquals(EquipmentStatus.LOANED, fx.registry.lookup(e2).status());
    }

    @Test
    @DisplayName("Equipment in maintenance or retired cannot be issued")
    void nonAvailableEquipmentRejected() {
        String s1 = fx.supervisor();
        String tech = fx.technician();
        String e1 = fx.equipment("QR-0001");
        fx.registry.transition(e1, EquipmentStatus.MAINTENANCE, tech);

        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e1, s1, s1));
        assertEquals(LedgerErrorCode.EQUIPMENT_UNAVAILABLE, ex.getCode());
    }

    @Test
    @DisplayName("Technicians may not issue loans and unknown ids are NOT_FOUND")
    void authorizationAndLookup() {
        String s1 = fx.supervisor();
        String tech = fx.technician();
        String e1 = fx.equipment("QR-0001");

        LedgerException denied = assertThrows(LedgerException.class, () -> fx.loans.issue(e1, s1, tech));
        assertEquals(LedgerErrorCode.UNAUTHORIZED, denied.getCode());

        LedgerException missing = assertThrows(LedgerException.class, () -> fx.loans.issue("EQ-NOPE", s1, s1));
        assertEquals(LedgerErrorCode.NOT_FOUND, missing.getCode());

        LedgerException noLoan = assertThrows(LedgerException.class, () -> fx.loans.returnLoan("LN-NOPE", s1));
        assertEquals(LedgerErrorCode.NOT_FOUND, noLoan.getCode());
    }

    @Test
    @DisplayName("Loans can only be issued to active supervisors")
    void issueToNonSupervisorRejected() {
        String s1 = fx.supervisor();
        String tech = fx.technician();
        String e1 = fx.equipment("QR-0001");

        LedgerException ex = assertThrows(LedgerException.class, () -> fx.loans.issue(e1, tech, s1));
        assertEquals(LedgerErrorCode.INVALID_INPUT, ex.getCode());
        assertEquals(EquipmentStatus.AVAILABLE, fx.registry.lookup(e1).status());
    }

    @Test
    @DisplayName("Issue and return each append their audit entries")
    void issueAndReturnAreAudited() {
        String s1 = fx.supervisor();
        String e1 = fx.equipment("QR-0001");
        String loanId = fx.loans.issue(e1, s1, s1);
        fx.loans.returnLoan(loanId, s1);

        List<AuditEntry> loanEntries = fx.auditTrail.query(AuditQuery.forEntity(loanId)).toList();
        assertEquals(2, loanEntries.size());
        assertEquals(AuditAction.LOAN_ISSUED, loanEntries.get(0).action());
        assertEquals(AuditAction.LOAN_RETURNED, loanEntries.get(1).action());
        assertEquals("RETURNED", loanEntries.get(1).afterStatus());
        assertEquals(s1, loanEntries.get(1).actorId());
    }

    @Test
    @DisplayName("Equipment history lists every loan in issue order")
    void historyForEquipment() {
        String s1 = fx.supervisor();
        String e1 = fx.equipment("QR-0001");
        String first = fx.loans.issue(e1, s1, s1);
        fx.clock.advance(Duration.ofHours(1));
        fx.loans.returnLoan(first, s1);
        fx.clock.advance(Duration.ofHours(1));
        String second = fx.loans.issue(e1, s1, s1);

        List<Loan> history = fx.loans.historyFor(e1);
        assertEquals(List.of(first, second), history.stream().map(Loan::loanId).toList());
        assertTrue(history.get(0).isReturned());
        assertFalse(history.get(1).isReturned());
    }
}
