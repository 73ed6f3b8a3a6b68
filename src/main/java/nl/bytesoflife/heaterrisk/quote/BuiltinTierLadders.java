package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.QualityTier;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.List;

/**
 * Factory for the built-in replacement product ladders.
 */
public class BuiltinTierLadders {

    private static volatile TierLadder cachedTank;
    private static volatile TierLadder cachedTankless;

    /**
     * Storage tank ladder, also used for heat pump units.
     * <ul>
     *   <li>Builder: 6 year warranty, about 10 years of life</li>
     *   <li>Standard: 9 years, about 12</li>
     *   <li>Professional: 12 years, about 14</li>
     *   <li>Premium: 15 years, about 18</li>
     * </ul>
     */
    public static TierLadder tank() {
        if (cachedTank == null) {
            synchronized (BuiltinTierLadders.class) {
                if (cachedTank == null) {
                    cachedTank = createTank();
                }
            }
        }
        return cachedTank;
    }

    /**
     * Tankless ladder with 5, 10, 12 and 15 year warranties.
     */
    public static TierLadder tankless() {
        if (cachedTankless == null) {
            synchronized (BuiltinTierLadders.class) {
                if (cachedTankless == null) {
                    cachedTankless = createTankless();
                }
            }
        }
        return cachedTankless;
    }

    public static TierLadder forFamily(UnitFamily family) {
        return family == UnitFamily.TANKLESS ? tankless() : tank();
    }

    private static TierLadder createTank() {
        return new TierLadder("Storage Tank", List.of(
                new TierProfile(QualityTier.BUILDER, "Builder Grade", 6, 10, 1400, 1200, 2800,
                        List.of("Basic glass-lined tank", "Single anode rod", "Standard thermostat")),
                new TierProfile(QualityTier.STANDARD, "Standard", 9, 12, 1900, 1600, 3400,
                        List.of("Premium glass lining", "Larger anode rod", "Self-cleaning dip tube")),
                new TierProfile(QualityTier.PROFESSIONAL, "Professional", 12, 14, 2600, 2200, 4200,
                        List.of("Dual anode rods", "High-recovery burner", "Brass drain valve")),
                new TierProfile(QualityTier.PREMIUM, "Premium / Lifetime", 15, 18, 3500, 3000, 5200,
                        List.of("Stainless tank or lifetime warranty", "Powered anode", "Leak detection"))
        ));
    }

    private static TierLadder createTankless() {
        return new TierLadder("Tankless", List.of(
                new TierProfile(QualityTier.BUILDER, "Economy Tankless", 5, 12, 2400, 1800, 0,
                        List.of("Basic heat exchanger", "Standard ignition", "Manual controls")),
                new TierProfile(QualityTier.STANDARD, "Standard Tankless", 10, 15, 3200, 2400, 0,
                        List.of("Copper heat exchanger", "Electronic ignition", "Digital display")),
                new TierProfile(QualityTier.PROFESSIONAL, "Professional Tankless", 12, 18, 4200, 3200, 0,
                        List.of("Premium copper heat exchanger", "Built-in recirculation", "Error diagnostics")),
                new TierProfile(QualityTier.PREMIUM, "Premium Tankless", 15, 20, 5500, 4200, 0,
                        List.of("Commercial-grade heat exchanger", "Condensing technology", "Leak detection"))
        ));
    }
}
