package nl.bytesoflife.heaterrisk.quote;

public enum InstallComplexity {
    STANDARD(1.0),
    CODE_UPGRADE(1.4),
    DIFFICULT_ACCESS(1.6),
    NEW_INSTALL(2.0);

    private final double laborMultiplier;

    InstallComplexity(double laborMultiplier) {
        this.laborMultiplier = laborMultiplier;
    }

    public double laborMultiplier() {
        return laborMultiplier;
    }
}
