package nl.bytesoflife.heaterrisk.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InspectionRecordTest {

    @Test
    void missingTelemetryUsesOptimisticDefaults() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANKLESS_GAS).withAge(4).build();

        assertEquals(60, record.getHousePsi(), 1e-9);
        assertEquals(FilterCondition.CLEAN, record.getInletFilter());
        assertEquals(FlameRodCondition.GOOD, record.getFlameRod());
        assertEquals(VentCondition.CLEAR, record.getTanklessVent());
        assertEquals(100, record.getIgniterHealthPercent(), 1e-9);
        assertEquals(100, record.getCompressorHealthPercent(), 1e-9);
        assertTrue(record.isCondensateClear());
        assertNull(record.getScaleBuildupScore());
    }

    @Test
    void regulatorClosesTheSystem() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withPrv(true).build();
        assertTrue(record.isClosedSystem());
        assertFalse(InspectionRecord.builder(UnitType.TANK_GAS).build().isClosedSystem());
    }

    @Test
    void waterloggedTankIsNotFunctional() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withExpansionTank(true)
                .withExpansionTankStatus(ExpansionTankStatus.WATERLOGGED)
                .build();
        assertTrue(record.hasExpansionTank());
        assertFalse(record.hasFunctionalExpansionTank());
    }

    @Test
    void demandControlledPumpDoesNotCirculateContinuously() {
        InspectionRecord timed = InspectionRecord.builder(UnitType.TANK_GAS)
                .withCircPump(true)
                .withCircPumpDemandControl(true)
                .build();
        InspectionRecord continuous = InspectionRecord.builder(UnitType.TANK_GAS)
                .withCircPump(true)
                .build();
        assertFalse(timed.hasContinuousCirculation());
        assertTrue(continuous.hasContinuousCirculation());
    }

    @Test
    void serviceHistoryRequiresInspectionDate() {
        InspectionRecord.Builder builder = InspectionRecord.builder(UnitType.TANK_GAS)
                .addServiceEvent(ServiceEventType.FLUSH, LocalDate.of(2023, 3, 1));
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void withWarrantyYearsKeepsEveryOtherField() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withAge(7)
                .withPsi(72)
                .withHardness(11)
                .withLocation(InstallLocation.ATTIC)
                .withInspectionDate(LocalDate.of(2024, 1, 1))
                .addServiceEvent(ServiceEventType.FLUSH, LocalDate.of(2023, 1, 1))
                .build();

        InspectionRecord premium = record.withWarrantyYears(15);

        assertEquals(15, premium.getWarrantyYears());
        assertEquals(6, record.getWarrantyYears());
        assertEquals(7, premium.getCalendarAge(), 1e-9);
        assertEquals(72, premium.getHousePsi(), 1e-9);
        assertEquals(InstallLocation.ATTIC, premium.getLocation());
        assertEquals(1, premium.getServiceHistory().size());
    }
}
