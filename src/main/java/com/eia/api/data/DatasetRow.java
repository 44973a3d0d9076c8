package com.eia.api.data;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One typed observation: a period ({@link OffsetDateTime} in UTC for hourly data,
 * {@link LocalDate} for daily data), a nullable value and the passthrough columns.
 */
public final class DatasetRow {

    private final Temporal period;
    private final Double value;
    private final Map<String, Object> attributes;

    public DatasetRow(Temporal period, Double value, Map<String, Object> attributes) {
        this.period = Objects.requireNonNull(period, "period");
        this.value = value;
        this.attributes = attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }

    public Temporal getPeriod() {
        return period;
    }

    public Double getValue() {
        return value;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String column) {
        return attributes.get(column);
    }

    /**
     * Period as an instant; daily periods map to midnight UTC.
     */
    public Instant toInstant() {
        if (period instanceof OffsetDateTime) {
            return ((OffsetDateTime) period).toInstant();
        }
        return ((LocalDate) period).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    long sortKey() {
        return toInstant().getEpochSecond();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatasetRow)) {
            return false;
        }
        DatasetRow other = (DatasetRow) o;
        return period.equals(other.period) && Objects.equals(value, other.value)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, value, attributes);
    }

    @Override
    public String toString() {
        return period + " " + value + " " + attributes;
    }
}
