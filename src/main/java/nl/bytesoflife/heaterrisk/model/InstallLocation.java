package nl.bytesoflife.heaterrisk.model;

public enum InstallLocation {
    ATTIC,
    UPPER_FLOOR,
    MAIN_LIVING,
    BASEMENT,
    GARAGE,
    EXTERIOR,
    CRAWLSPACE;

    /**
     * True for locations where a leak drains through the living space below.
     */
    public boolean isAboveLivingSpace() {
        return this == ATTIC || this == UPPER_FLOOR;
    }
}
