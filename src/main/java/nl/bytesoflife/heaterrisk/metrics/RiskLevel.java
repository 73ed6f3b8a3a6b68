package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InstallLocation;

/**
 * Consequence of a leak at the install location, from a slab garage to an attic over a ceiling.
 * <p>
 * Levels run 1 to 4. There is no level 0: every location carries some leak consequence, and an
 * exterior or unfinished garage install is the floor at {@link #LOW}.
 */
public enum RiskLevel {
    LOW(1),
    MODERATE(2),
    HIGH(3),
    EXTREME(4);

    private final int level;

    RiskLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean isAtLeast(RiskLevel other) {
        return level >= other.level;
    }

    public static RiskLevel forLocation(InstallLocation location, boolean finishedArea) {
        return switch (location) {
            case ATTIC, UPPER_FLOOR -> EXTREME;
            case MAIN_LIVING -> HIGH;
            case BASEMENT -> finishedArea ? HIGH : MODERATE;
            case GARAGE, CRAWLSPACE -> finishedArea ? MODERATE : LOW;
            case EXTERIOR -> LOW;
        };
    }
}
