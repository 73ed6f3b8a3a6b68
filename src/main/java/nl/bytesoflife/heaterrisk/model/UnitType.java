package nl.bytesoflife.heaterrisk.model;

public enum UnitType {
    TANK_GAS(UnitFamily.TANK, true),
    TANK_ELECTRIC(UnitFamily.TANK, false),
    TANKLESS_GAS(UnitFamily.TANKLESS, true),
    TANKLESS_ELECTRIC(UnitFamily.TANKLESS, false),
    HYBRID_HEAT_PUMP(UnitFamily.HYBRID, false);

    private final UnitFamily family;
    private final boolean gasFired;

    UnitType(UnitFamily family, boolean gasFired) {
        this.family = family;
        this.gasFired = gasFired;
    }

    public UnitFamily family() {
        return family;
    }

    public boolean isGasFired() {
        return gasFired;
    }

    /**
     * Tank and hybrid units store water and carry a sacrificial anode.
     */
    public boolean hasStorageTank() {
        return family != UnitFamily.TANKLESS;
    }
}
