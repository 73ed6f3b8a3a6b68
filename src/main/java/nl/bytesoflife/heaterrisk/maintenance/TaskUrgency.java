package nl.bytesoflife.heaterrisk.maintenance;

import nl.bytesoflife.heaterrisk.metrics.FlushStatus;

/**
 * How pressing a maintenance task is, from nothing to do yet to cannot be done at all.
 */
public enum TaskUrgency {
    OPTIMAL,
    ADVISORY,
    SCHEDULE,
    DUE,
    CRITICAL,
    OVERDUE,
    /** The task cannot be performed until something else is fixed first. */
    IMPOSSIBLE;

    static TaskUrgency fromFlushStatus(FlushStatus status) {
        return switch (status) {
            case LOCKOUT -> OVERDUE;
            case CRITICAL -> CRITICAL;
            case DUE -> DUE;
            case ADVISORY -> ADVISORY;
            case OPTIMAL -> OPTIMAL;
        };
    }

    public boolean isActionable() {
        return this != OPTIMAL && this != IMPOSSIBLE;
    }
}
