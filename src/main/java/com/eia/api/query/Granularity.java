package com.eia.api.query;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Precision of a time bound. The API accepts nothing finer than an hour.
 */
public enum Granularity {

    HOUR(ChronoUnit.HOURS, DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH")),
    DAY(ChronoUnit.DAYS, DateTimeFormatter.ISO_LOCAL_DATE);

    private final ChronoUnit unit;
    private final DateTimeFormatter formatter;

    Granularity(ChronoUnit unit, DateTimeFormatter formatter) {
        this.unit = unit;
        this.formatter = formatter;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    /**
     * Wire format of a bound: {@code YYYY-MM-DD} or {@code YYYY-MM-DDTHH}.
     */
    public String format(LocalDateTime bound) {
        return formatter.format(bound);
    }

    public LocalDateTime truncate(LocalDateTime value) {
        return value.truncatedTo(unit);
    }

    public LocalDateTime plus(LocalDateTime value, long units) {
        return value.plus(units, unit);
    }

    /**
     * Number of periods in the closed interval {@code [start, end]}.
     */
    public long periodsBetween(LocalDateTime start, LocalDateTime end) {
        return unit.between(start, end) + 1;
    }
}
