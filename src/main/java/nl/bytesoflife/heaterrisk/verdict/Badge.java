package nl.bytesoflife.heaterrisk.verdict;

public enum Badge {
    CRITICAL,
    REPLACE,
    SERVICE,
    MONITOR,
    OPTIMAL
}
