package nl.bytesoflife.heaterrisk.repair;

public enum HealthStatus {
    OPTIMAL,
    WARNING,
    CRITICAL;

    public static HealthStatus fromScore(int score) {
        if (score >= 70) return OPTIMAL;
        if (score >= 40) return WARNING;
        return CRITICAL;
    }
}
