package com.eia.api.query;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

import com.eia.api.exceptions.InvalidArgumentException;

/**
 * Closed interval {@code [start, end]} at a single granularity. Hourly bounds are
 * truncated to the hour.
 */
public final class TimeRange {

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Granularity granularity;

    private TimeRange(LocalDateTime start, LocalDateTime end, Granularity granularity) {
        if (start == null || end == null) {
            throw new InvalidArgumentException("Range bounds must not be null");
        }
        this.start = granularity.truncate(start);
        this.end = granularity.truncate(end);
        this.granularity = granularity;
        if (this.start.isAfter(this.end)) {
            throw new InvalidArgumentException("Range start " + format(this.start)
                    + " is after end " + format(this.end));
        }
    }

    public static TimeRange ofDays(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidArgumentException("Range bounds must not be null");
        }
        return new TimeRange(start.atStartOfDay(), end.atStartOfDay(), Granularity.DAY);
    }

    public static TimeRange ofHours(LocalDateTime start, LocalDateTime end) {
        return new TimeRange(start, end, Granularity.HOUR);
    }

    public static TimeRange of(LocalDateTime start, LocalDateTime end, Granularity granularity) {
        if (granularity == null) {
            throw new InvalidArgumentException("Granularity must not be null");
        }
        return new TimeRange(start, end, granularity);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public long periodCount() {
        return granularity.periodsBetween(start, end);
    }

    public boolean contains(LocalDateTime period) {
        return !period.isBefore(start) && !period.isAfter(end);
    }

    public String formatStart() {
        return format(start);
    }

    public String formatEnd() {
        return format(end);
    }

    private String format(LocalDateTime bound) {
        return granularity.format(bound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeRange)) {
            return false;
        }
        TimeRange other = (TimeRange) o;
        return start.equals(other.start) && end.equals(other.end) && granularity == other.granularity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, granularity);
    }

    @Override
    public String toString() {
        return "[" + formatStart() + ", " + formatEnd() + "]";
    }
}
