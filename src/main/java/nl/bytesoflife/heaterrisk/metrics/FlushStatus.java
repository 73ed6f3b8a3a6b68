package nl.bytesoflife.heaterrisk.metrics;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

public enum FlushStatus {
    OPTIMAL,
    ADVISORY,
    DUE,
    CRITICAL,
    LOCKOUT;

    static FlushStatus fromSediment(double sedimentLbs) {
        if (sedimentLbs > SEDIMENT_LOCKOUT) return LOCKOUT;
        if (sedimentLbs >= SEDIMENT_CRITICAL) return CRITICAL;
        if (sedimentLbs >= SEDIMENT_SERVICEABLE) return DUE;
        if (sedimentLbs >= SEDIMENT_ADVISORY) return ADVISORY;
        return OPTIMAL;
    }

    static FlushStatus fromDescale(DescaleStatus status) {
        return switch (status) {
            case LOCKOUT, RUN_TO_FAILURE -> LOCKOUT;
            case CRITICAL -> CRITICAL;
            case DUE -> DUE;
            case OPTIMAL -> OPTIMAL;
        };
    }
}
