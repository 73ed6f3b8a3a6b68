package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.InstallLocation;
import nl.bytesoflife.heaterrisk.model.ServiceEventType;
import nl.bytesoflife.heaterrisk.model.ThermostatSetting;
import nl.bytesoflife.heaterrisk.model.UnitType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TankMetricsCalculatorTest {

    private static final LocalDate INSPECTED = LocalDate.of(2024, 6, 1);

    private final TankMetricsCalculator calculator = new TankMetricsCalculator();

    @Test
    void benignUnitAgesAtCalendarRate() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(50)
                .withThermostat(ThermostatSetting.LOW)
                .build();

        DegradationMetrics metrics = calculator.calculate(record);

        assertEquals(4.0, metrics.bioAge(), 1e-9);
        assertEquals(Stressor.NONE, metrics.aging().primaryStressor());
    }

    @Test
    void biologicalAgeNeverDecreasesWithCalendarAge() {
        double previous = -1;
        for (int age = 0; age <= 30; age++) {
            InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                    .withAge(age)
                    .withPsi(90)
                    .withHardness(12)
                    .build();
            double bioAge = calculator.calculate(record).bioAge();
            assertTrue(bioAge >= previous, "bio age dropped at calendar age " + age);
            previous = bioAge;
        }
    }

    @Test
    void oldTankIsCappedAtDisplayCeiling() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(20)
                .withHardness(5)
                .build();

        DegradationMetrics metrics = calculator.calculate(record);

        assertEquals(20.0, metrics.bioAge(), 1e-9);
        assertEquals(66.15, metrics.failProb(), 0.01);
        assertEquals(7, metrics.healthScore());
        assertEquals(AnodeStatus.DEPLETED, metrics.anodeStatus());
    }

    @Test
    void electricTankCollectsMoreSedimentThanGas() {
        InspectionRecord gas = InspectionRecord.builder(UnitType.TANK_GAS).withAge(5).withHardness(15).build();
        InspectionRecord electric = InspectionRecord.builder(UnitType.TANK_ELECTRIC).withAge(5).withHardness(15).build();

        assertEquals(3.3, calculator.calculate(gas).sedimentLbs(), 1e-6);
        assertEquals(6.0, calculator.calculate(electric).sedimentLbs(), 1e-6);
        assertEquals(FlushStatus.DUE, calculator.calculate(electric).flushStatus());
    }

    @Test
    void recentFlushHalvesSediment() {
        InspectionRecord unflushed = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withAge(6)
                .withHardness(10)
                .build();
        InspectionRecord flushed = unflushed.toBuilder()
                .withInspectionDate(INSPECTED)
                .addServiceEvent(ServiceEventType.FLUSH, INSPECTED.minusMonths(5))
                .build();

        assertEquals(4.8, calculator.calculate(unflushed).sedimentLbs(), 1e-6);
        assertEquals(2.4, calculator.calculate(flushed).sedimentLbs(), 1e-6);
    }

    @Test
    void softenerAndContinuousCirculationShortenAnodeLife() {
        InspectionRecord softened = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(1)
                .withSoftener(true)
                .build();
        InspectionRecord circulating = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(1)
                .withCircPump(true)
                .build();

        assertEquals(1.5, calculator.calculate(softened).shieldLife(), 1e-9);
        assertEquals(3.0, calculator.calculate(circulating).shieldLife(), 1e-9);
    }

    @Test
    void anodeReplacementRestoresShield() {
        InspectionRecord original = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(10)
                .withPsi(50)
                .build();
        InspectionRecord replaced = original.toBuilder()
                .withInspectionDate(INSPECTED)
                .addServiceEvent(ServiceEventType.ANODE_REPLACEMENT, INSPECTED.minusYears(2))
                .build();

        DegradationMetrics before = calculator.calculate(original);
        DegradationMetrics after = calculator.calculate(replaced);

        assertEquals(-4.0, before.shieldLife(), 1e-9);
        assertEquals(4.0, after.shieldLife(), 0.01);
        assertEquals(AnodeStatus.PROTECTED, after.anodeStatus());
        assertTrue(after.bioAge() < before.bioAge());
    }

    @Test
    void nakedYearsSplitAroundAnodeReplacement() {
        assertEquals(4.0, TankMetricsCalculator.nakedYears(10, 6, null), 1e-9);
        // rod spent at 6, replaced at 8, second rod good until 14
        assertEquals(2.0, TankMetricsCalculator.nakedYears(10, 6, 8.0), 1e-9);
        assertEquals(3.0, TankMetricsCalculator.nakedYears(15, 6, 8.0), 1e-9);
    }

    @Test
    void breachForcesNearCertainFailure() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(2)
                .withActiveLeak(true)
                .build();

        DegradationMetrics metrics = calculator.calculate(record);

        assertEquals(99.9, metrics.failProb(), 1e-9);
        assertEquals(2, metrics.healthScore());
    }

    @Test
    void scoresStayInBoundsAcrossHarshInputs() {
        for (int age = 0; age <= 40; age += 5) {
            for (int psi = 40; psi <= 160; psi += 30) {
                InspectionRecord record = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                        .withAge(age)
                        .withPsi(psi)
                        .withHardness(30)
                        .withThermostat(ThermostatSetting.HOT)
                        .withCircPump(true)
                        .withClosedLoop(true)
                        .build();
                DegradationMetrics metrics = calculator.calculate(record);
                assertTrue(metrics.healthScore() >= 0 && metrics.healthScore() <= 100);
                assertTrue(metrics.failProb() >= 0 && metrics.failProb() <= 100);
                assertTrue(metrics.bioAge() <= 20.0);
            }
        }
    }

    @Test
    void highPressureIsThePrimaryStressor() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(5)
                .withPsi(100)
                .build();

        DegradationMetrics metrics = calculator.calculate(record);

        assertEquals(2.0, metrics.stress().pressure(), 1e-9);
        assertEquals(Stressor.PRESSURE, metrics.aging().primaryStressor());
        assertTrue(metrics.aging().optimizedRate() < metrics.aging().agingRate());
        assertTrue(metrics.aging().lifeExtension() > 0);
    }

    @Test
    void atticInstallIsExtremeRisk() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withLocation(InstallLocation.ATTIC)
                .build();
        assertEquals(RiskLevel.EXTREME, calculator.calculate(record).riskLevel());
    }

    @Test
    void exteriorInstallIsLowestRiskLevel() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withLocation(InstallLocation.EXTERIOR)
                .build();
        RiskLevel risk = calculator.calculate(record).riskLevel();

        assertEquals(RiskLevel.LOW, risk);
        assertEquals(1, risk.level());
        assertEquals(4, RiskLevel.EXTREME.level());
    }
}
