package nl.bytesoflife.heaterrisk.verdict;

public enum Action {
    REPLACE,
    REPAIR,
    UPGRADE,
    MAINTAIN,
    PASS,
    /** Immediate safety hazard that must be made safe before anything else is discussed. */
    URGENT
}
