package nl.bytesoflife.heaterrisk.metrics;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * When routine tank maintenance helps and when it does harm. The verdict and the repair menu
 * both decide from these, so they never disagree.
 */
public final class ServiceWindows {

    private ServiceWindows() {
    }

    /**
     * Enough sediment to be worth a flush, but not so much that flushing risks a blockage.
     */
    public static boolean isServiceableSediment(double sedimentLbs) {
        return sedimentLbs >= SEDIMENT_SERVICEABLE && sedimentLbs <= SEDIMENT_LOCKOUT;
    }

    /**
     * A fragile tank may be held together by the deposits a flush would remove.
     */
    public static boolean isFragile(double calendarAge, double failProb) {
        return failProb > FRAGILE_FAIL_PROB || calendarAge > FRAGILE_AGE;
    }

    public static boolean isAnodeRefreshWindow(double shieldLife, double calendarAge) {
        return shieldLife < 1 && calendarAge < ANODE_AGE_LIMIT;
    }
}
