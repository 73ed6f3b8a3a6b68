package nl.bytesoflife.heaterrisk.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A dated maintenance event from the unit's service history.
 *
 * @param type what was done
 * @param date the day it was done
 */
public record ServiceEvent(ServiceEventType type, LocalDate date) {

    public ServiceEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(date, "date");
    }

    public static ServiceEvent of(ServiceEventType type, LocalDate date) {
        return new ServiceEvent(type, date);
    }
}
