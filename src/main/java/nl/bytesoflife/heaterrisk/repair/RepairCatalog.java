package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The menu of repairs with their prices and nominal impact.
 * <p>
 * Pressure regulators are only handed out through {@link #pressureRegulator(ExpansionProtection)}
 * and {@link #regulatorReplacement(ExpansionProtection)}, which return the bundled regulator and
 * expansion tank whenever the system lacks expansion protection.
 */
public class RepairCatalog {

    private static final Set<UnitFamily> STORAGE = EnumSet.of(UnitFamily.TANK, UnitFamily.HYBRID);
    private static final Set<UnitFamily> ALL = EnumSet.allOf(UnitFamily.class);

    private static volatile RepairCatalog cachedBuiltin;

    private final Map<RepairKind, RepairOption> options = new EnumMap<>(RepairKind.class);

    public RepairCatalog(List<RepairOption> options) {
        for (RepairOption option : options) {
            if (this.options.put(option.kind(), option) != null) {
                throw new IllegalArgumentException("Duplicate repair option " + option.id());
            }
        }
    }

    public static RepairCatalog builtin() {
        if (cachedBuiltin == null) {
            synchronized (RepairCatalog.class) {
                if (cachedBuiltin == null) {
                    cachedBuiltin = createBuiltin();
                }
            }
        }
        return cachedBuiltin;
    }

    public RepairOption replacementFor(UnitFamily family) {
        return option(switch (family) {
            case TANK -> RepairKind.REPLACE_TANK;
            case TANKLESS -> RepairKind.REPLACE_TANKLESS;
            case HYBRID -> RepairKind.REPLACE_HYBRID;
        });
    }

    /**
     * A new pressure regulator, bundled with an expansion tank unless expansion is already handled.
     */
    public RepairOption pressureRegulator(ExpansionProtection protection) {
        return option(protection == ExpansionProtection.MISSING
                ? RepairKind.PRV_WITH_EXPANSION_TANK
                : RepairKind.PRV);
    }

    /**
     * Replacement of a failed regulator, bundled with an expansion tank unless expansion is already handled.
     */
    public RepairOption regulatorReplacement(ExpansionProtection protection) {
        return option(protection == ExpansionProtection.MISSING
                ? RepairKind.REPLACE_PRV_WITH_EXPANSION_TANK
                : RepairKind.REPLACE_PRV);
    }

    /**
     * Looks up a non-regulator option.
     *
     * @throws IllegalArgumentException for regulator kinds, which depend on expansion protection
     */
    public RepairOption get(RepairKind kind) {
        if (kind.isRegulator()) {
            throw new IllegalArgumentException(kind.id() + " must be obtained through pressureRegulator/regulatorReplacement");
        }
        return option(kind);
    }

    RepairOption option(RepairKind kind) {
        RepairOption option = options.get(kind);
        if (option == null) {
            throw new IllegalStateException("Repair catalog has no option " + kind.id());
        }
        return option;
    }

    private static RepairCatalog createBuiltin() {
        return new RepairCatalog(List.of(
                new RepairOption(RepairKind.REPLACE_TANK, "Full Tank Replacement",
                        "Remove the old tank and install a new unit to current code",
                        EnumSet.of(UnitFamily.TANK), CostRange.of(2800, 4500), RepairImpact.AS_NEW),
                new RepairOption(RepairKind.REPLACE_TANKLESS, "Full Tankless Replacement",
                        "Remove the old unit and install a new tankless heater",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(3500, 5500), RepairImpact.AS_NEW),
                new RepairOption(RepairKind.REPLACE_HYBRID, "Full Heat Pump Replacement",
                        "Remove the old unit and install a new heat pump water heater",
                        EnumSet.of(UnitFamily.HYBRID), CostRange.of(3800, 5800), RepairImpact.AS_NEW),

                new RepairOption(RepairKind.PRV, "Install Pressure Regulator",
                        "Install a pressure reducing valve at the main",
                        ALL, CostRange.of(350, 550), new RepairImpact(20, 25, 30)),
                new RepairOption(RepairKind.PRV_WITH_EXPANSION_TANK, "Pressure Regulator + Expansion Tank",
                        "Install a pressure reducing valve with the expansion tank the closed system needs",
                        STORAGE, CostRange.of(600, 950), new RepairImpact(35, 45, 55)),
                new RepairOption(RepairKind.REPLACE_PRV, "Replace Pressure Regulator",
                        "Replace the failed pressure reducing valve",
                        ALL, CostRange.of(350, 550), new RepairImpact(22, 28, 35)),
                new RepairOption(RepairKind.REPLACE_PRV_WITH_EXPANSION_TANK, "Replace Regulator + Expansion Tank",
                        "Replace the failed pressure reducing valve and the expansion tank",
                        STORAGE, CostRange.of(600, 950), new RepairImpact(38, 48, 58)),
                new RepairOption(RepairKind.EXPANSION_TANK, "Install Expansion Tank",
                        "Install a thermal expansion tank on the cold supply",
                        STORAGE, CostRange.of(250, 400), new RepairImpact(15, 20, 25)),
                new RepairOption(RepairKind.REPLACE_EXPANSION_TANK, "Replace Expansion Tank",
                        "Replace the waterlogged expansion tank",
                        STORAGE, CostRange.of(250, 400), new RepairImpact(18, 22, 28)),
                new RepairOption(RepairKind.FLUSH, "Tank Flush",
                        "Drain and flush sediment from the tank floor",
                        STORAGE, CostRange.of(150, 250), new RepairImpact(15, 25, 20)),
                new RepairOption(RepairKind.ANODE, "Anode Replacement",
                        "Replace the sacrificial anode rod",
                        STORAGE, CostRange.of(200, 350), new RepairImpact(18, 35, 25)),

                new RepairOption(RepairKind.ISOLATION_VALVES, "Install Isolation Valves",
                        "Install service valves so the unit can be descaled",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(400, 650), new RepairImpact(10, 15, 20)),
                new RepairOption(RepairKind.DESCALE, "Descale Heat Exchanger",
                        "Circulate descaling solution through the heat exchanger",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(200, 350), new RepairImpact(20, 30, 25)),
                new RepairOption(RepairKind.INLET_FILTER, "Clean Inlet Filter",
                        "Clean or replace the cold water inlet screen",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(75, 150), new RepairImpact(8, 10, 12)),
                new RepairOption(RepairKind.IGNITER_SERVICE, "Igniter Service",
                        "Clean or replace the igniter and flame rod",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(150, 300), new RepairImpact(12, 15, 18)),
                new RepairOption(RepairKind.FLOW_SENSOR, "Flow Sensor Replacement",
                        "Replace the flow sensor",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(200, 400), new RepairImpact(15, 20, 22)),
                new RepairOption(RepairKind.VENT_CLEANING, "Vent Cleaning",
                        "Clear the exhaust and intake vent runs",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(150, 300), new RepairImpact(10, 12, 15)),
                new RepairOption(RepairKind.RECIRCULATION_SERVICE, "Recirculation Service",
                        "Service the recirculation pump and check valve",
                        EnumSet.of(UnitFamily.TANKLESS), CostRange.of(200, 400), new RepairImpact(8, 20, 15)),

                new RepairOption(RepairKind.AIR_FILTER_SERVICE, "Air Filter Service",
                        "Clean or replace the heat pump air filter",
                        EnumSet.of(UnitFamily.HYBRID), CostRange.of(50, 100), new RepairImpact(10, 15, 10)),
                new RepairOption(RepairKind.CONDENSATE_CLEAR, "Clear Condensate Line",
                        "Clear the condensate drain and trap",
                        EnumSet.of(UnitFamily.HYBRID), CostRange.of(100, 200), new RepairImpact(8, 10, 12)),
                new RepairOption(RepairKind.COMPRESSOR_SERVICE, "Compressor Service",
                        "Service the compressor and check its electrical draw",
                        EnumSet.of(UnitFamily.HYBRID), CostRange.of(300, 600), new RepairImpact(20, 25, 30)),
                new RepairOption(RepairKind.REFRIGERANT_CHECK, "Refrigerant Check",
                        "Check refrigerant charge and look for leaks",
                        EnumSet.of(UnitFamily.HYBRID), CostRange.of(200, 400), new RepairImpact(15, 20, 18))
        ));
    }
}
