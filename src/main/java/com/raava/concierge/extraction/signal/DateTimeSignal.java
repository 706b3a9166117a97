package com.raava.concierge.extraction.signal;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A date, a time, or both. A time alone adjusts a date given earlier.
 */
public record DateTimeSignal(LocalDate date, LocalTime time) implements Signal {

    public static final LocalTime DEFAULT_TIME = LocalTime.of(10, 0);

    /**
     * Combines this signal with a previously stored value.
     *
     * @param existing value already held, may be null
     * @return the new date-time, or null when no date is known yet
     */
    public LocalDateTime resolve(LocalDateTime existing) {
        LocalDate resolvedDate = date != null ? date : existing != null ? existing.toLocalDate() : null;
        if (resolvedDate == null) {
            return null;
        }
        LocalTime resolvedTime = time != null ? time : existing != null ? existing.toLocalTime() : DEFAULT_TIME;
        return resolvedDate.atTime(resolvedTime);
    }
}
