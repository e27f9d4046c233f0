package in.equiptrack.domain.equipment;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static in.equiptrack.domain.equipment.EquipmentStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class EquipmentStatusTest {

    @Test
    void legalEdges() {
        assertTrue(AVAILABLE.canTransitionTo(LOANED));
        assertTrue(AVAILABLE.canTransitionTo(MAINTENANCE));
        assertTrue(AVAILABLE.canTransitionTo(RETIRED));
        assertTrue(LOANED.canTransitionTo(AVAILABLE));
        assertTrue(LOANED.canTransitionTo(RETIRED));
        assertTrue(MAINTENANCE.canTransitionTo(AVAILABLE));
        assertTrue(MAINTENANCE.canTransitionTo(RETIRED));
    }

    @Test
    void illegalEdges() {
        assertFalse(LOANED.canTransitionTo(MAINTENANCE));
        assertFalse(MAINTENANCE.canTransitionTo(LOANED));
        assertFalse(AVAILABLE.canTransitionTo(null));
    }

    @ParameterizedTest
    @EnumSource(EquipmentStatus.class)
    void noSelfTransitionsAndRetiredIsTerminal(EquipmentStatus status) {
        assertFalse(status.canTransitionTo(status));
        assertFalse(RETIRED.canTransitionTo(status));
        assertEquals(status == RETIRED, status.isTerminal());
    }
}
