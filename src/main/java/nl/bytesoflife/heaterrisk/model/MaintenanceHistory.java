package nl.bytesoflife.heaterrisk.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Recency-weighted view over a unit's service history.
 * All functions take the evaluation date explicitly; nothing here reads the clock.
 */
public final class MaintenanceHistory {

    static final double DAYS_PER_YEAR = 365.25;

    /** Events younger than this earn full credit. */
    public static final double FULL_CREDIT_YEARS = 1.0;
    /** Credit decays linearly until this age and stays at the floor afterwards. */
    public static final double DECAY_END_YEARS = 4.0;
    public static final double FLOOR_WEIGHT = 0.25;

    private MaintenanceHistory() {
    }

    public static double yearsSince(LocalDate eventDate, LocalDate asOf) {
        long days = ChronoUnit.DAYS.between(eventDate, asOf);
        return Math.max(0, days / DAYS_PER_YEAR);
    }

    /**
     * Years since the most recent event of the given type, ignoring events dated after {@code asOf}.
     */
    public static OptionalDouble yearsSinceLast(List<ServiceEvent> events, ServiceEventType type, LocalDate asOf) {
        LocalDate latest = null;
        for (ServiceEvent event : events) {
            if (event.type() != type || event.date().isAfter(asOf)) continue;
            if (latest == null || event.date().isAfter(latest)) {
                latest = event.date();
            }
        }
        return latest == null ? OptionalDouble.empty() : OptionalDouble.of(yearsSince(latest, asOf));
    }

    /**
     * Weight given to a maintenance event performed {@code yearsAgo} years back.
     * 1.0 inside the first year, linear decay to {@link #FLOOR_WEIGHT} at four years, floor thereafter.
     */
    public static double recencyWeight(double yearsAgo) {
        if (yearsAgo < FULL_CREDIT_YEARS) {
            return 1.0;
        }
        if (yearsAgo >= DECAY_END_YEARS) {
            return FLOOR_WEIGHT;
        }
        double progress = (yearsAgo - FULL_CREDIT_YEARS) / (DECAY_END_YEARS - FULL_CREDIT_YEARS);
        return 1.0 - progress * (1.0 - FLOOR_WEIGHT);
    }

    /**
     * Strongest recency weight among events of the given type, or 0 when none happened.
     */
    public static double creditFor(List<ServiceEvent> events, ServiceEventType type, LocalDate asOf) {
        OptionalDouble years = yearsSinceLast(events, type, asOf);
        return years.isPresent() ? recencyWeight(years.getAsDouble()) : 0.0;
    }
}
