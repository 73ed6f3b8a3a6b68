package nl.bytesoflife.heaterrisk.metrics;

public enum AnodeStatus {
    PROTECTED,
    INSPECT,
    REPLACE,
    DEPLETED,
    NOT_APPLICABLE;

    static AnodeStatus fromShieldLife(double shieldLife) {
        if (shieldLife < 0) return DEPLETED;
        if (shieldLife < 1) return REPLACE;
        if (shieldLife < 2) return INSPECT;
        return PROTECTED;
    }
}
