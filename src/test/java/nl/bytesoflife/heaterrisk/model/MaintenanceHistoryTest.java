package nl.bytesoflife.heaterrisk.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceHistoryTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Test
    void recentEventEarnsFullCredit() {
        assertEquals(1.0, MaintenanceHistory.recencyWeight(0.0), 1e-9);
        assertEquals(1.0, MaintenanceHistory.recencyWeight(0.9), 1e-9);
    }

    @Test
    void creditDecaysLinearlyBetweenOneAndFourYears() {
        assertEquals(1.0, MaintenanceHistory.recencyWeight(1.0), 1e-9);
        assertEquals(0.625, MaintenanceHistory.recencyWeight(2.5), 1e-9);
        assertTrue(MaintenanceHistory.recencyWeight(2.0) > MaintenanceHistory.recencyWeight(3.0));
    }

    @Test
    void oldEventsKeepFloorWeight() {
        assertEquals(0.25, MaintenanceHistory.recencyWeight(4.0), 1e-9);
        assertEquals(0.25, MaintenanceHistory.recencyWeight(12.0), 1e-9);
    }

    @Test
    void yearsSinceLastPicksMostRecentEventOfType() {
        List<ServiceEvent> events = List.of(
                ServiceEvent.of(ServiceEventType.FLUSH, TODAY.minusYears(3)),
                ServiceEvent.of(ServiceEventType.FLUSH, TODAY.minusDays(73)),
                ServiceEvent.of(ServiceEventType.ANODE_REPLACEMENT, TODAY.minusDays(10)));

        OptionalDouble years = MaintenanceHistory.yearsSinceLast(events, ServiceEventType.FLUSH, TODAY);
        assertTrue(years.isPresent());
        assertEquals(0.2, years.getAsDouble(), 0.001);
    }

    @Test
    void eventsAfterEvaluationDateAreIgnored() {
        List<ServiceEvent> events = List.of(ServiceEvent.of(ServiceEventType.DESCALE, TODAY.plusDays(30)));
        assertTrue(MaintenanceHistory.yearsSinceLast(events, ServiceEventType.DESCALE, TODAY).isEmpty());
        assertEquals(0.0, MaintenanceHistory.creditFor(events, ServiceEventType.DESCALE, TODAY), 1e-9);
    }

    @Test
    void noEventOfTypeGivesNoCredit() {
        List<ServiceEvent> events = List.of(ServiceEvent.of(ServiceEventType.INSPECTION, TODAY.minusDays(5)));
        assertEquals(0.0, MaintenanceHistory.creditFor(events, ServiceEventType.FLUSH, TODAY), 1e-9);
    }
}
