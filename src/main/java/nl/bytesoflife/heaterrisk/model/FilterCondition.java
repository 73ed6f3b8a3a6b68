package nl.bytesoflife.heaterrisk.model;

/**
 * Condition of an inlet screen (tankless) or air filter (heat pump).
 */
public enum FilterCondition {
    CLEAN,
    DIRTY,
    CLOGGED;

    public boolean needsService() {
        return this != CLEAN;
    }
}
