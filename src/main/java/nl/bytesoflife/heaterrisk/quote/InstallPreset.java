package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.VentType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A contractor's installation price for one vent type and job complexity.
 *
 * @param ventType       vent type the price applies to
 * @param complexity     job complexity
 * @param laborCost      labor in dollars
 * @param materialsCost  fittings, connectors and the like
 * @param permitCost     permit fee
 * @param estimatedHours time on site
 */
public record InstallPreset(
        VentType ventType,
        InstallComplexity complexity,
        int laborCost,
        int materialsCost,
        int permitCost,
        double estimatedHours
) {
    public InstallPreset {
        Objects.requireNonNull(ventType, "ventType");
        Objects.requireNonNull(complexity, "complexity");
        if (laborCost < 0 || materialsCost < 0 || permitCost < 0) {
            throw new IllegalArgumentException("Install costs must not be negative");
        }
    }

    public int totalCost() {
        return laborCost + materialsCost + permitCost;
    }

    /**
     * Starting presets for a contractor who has not entered their own: labor by vent type scaled
     * by the complexity multiplier.
     */
    public static List<InstallPreset> defaults() {
        List<InstallPreset> presets = new ArrayList<>();
        for (VentType ventType : VentType.values()) {
            for (InstallComplexity complexity : InstallComplexity.values()) {
                presets.add(new InstallPreset(
                        ventType,
                        complexity,
                        (int) Math.round(baseLabor(ventType) * complexity.laborMultiplier()),
                        switch (complexity) {
                            case CODE_UPGRADE -> 200;
                            case NEW_INSTALL -> 300;
                            default -> 100;
                        },
                        complexity == InstallComplexity.NEW_INSTALL ? 150 : 75,
                        switch (complexity) {
                            case STANDARD -> 2.5;
                            case CODE_UPGRADE -> 4.0;
                            case DIFFICULT_ACCESS -> 5.0;
                            case NEW_INSTALL -> 6.0;
                        }));
            }
        }
        return presets;
    }

    private static int baseLabor(VentType ventType) {
        return switch (ventType) {
            case ATMOSPHERIC -> 350;
            case POWER_VENT -> 550;
            case DIRECT_VENT -> 500;
        };
    }
}
