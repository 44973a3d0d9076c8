package com.eia.api.data;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import com.eia.api.query.Frequency;

/**
 * Typed table sorted by period ascending. Columns are {@code period}, {@code value}
 * and the passthrough columns in first-seen order.
 */
public final class Dataset {

    public static final String PERIOD = "period";
    public static final String VALUE = "value";

    private final Frequency frequency;
    private final List<String> passthroughColumns;
    private final List<DatasetRow> rows;

    public Dataset(Frequency frequency, List<String> passthroughColumns, List<DatasetRow> rows) {
        this.frequency = Objects.requireNonNull(frequency, "frequency");
        this.passthroughColumns = Collections.unmodifiableList(new ArrayList<>(passthroughColumns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public List<DatasetRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> getColumns() {
        List<String> columns = new ArrayList<>(passthroughColumns.size() + 2);
        columns.add(PERIOD);
        columns.add(VALUE);
        columns.addAll(passthroughColumns);
        return columns;
    }

    public List<String> getPassthroughColumns() {
        return passthroughColumns;
    }

    public List<Temporal> getPeriods() {
        List<Temporal> periods = new ArrayList<>(rows.size());
        for (DatasetRow row : rows) {
            periods.add(row.getPeriod());
        }
        return periods;
    }

    public List<Double> getValues() {
        List<Double> values = new ArrayList<>(rows.size());
        for (DatasetRow row : rows) {
            values.add(row.getValue());
        }
        return values;
    }

    /**
     * Columns identifying a series: passthrough columns that are not descriptive
     * ({@code *-name}) or unit ({@code *-units}) columns.
     */
    public List<String> getIdentifierColumns() {
        List<String> identifiers = new ArrayList<>();
        for (String column : passthroughColumns) {
            if (!column.endsWith("-name") && !column.endsWith("-units")) {
                identifiers.add(column);
            }
        }
        return identifiers;
    }

    /**
     * Label of the series a row belongs to, e.g. {@code CISO/SDGE}; {@code value}
     * when the dataset has no identifier columns.
     */
    public String seriesKey(DatasetRow row) {
        List<String> identifiers = getIdentifierColumns();
        if (identifiers.isEmpty()) {
            return VALUE;
        }
        StringJoiner key = new StringJoiner("/");
        for (String column : identifiers) {
            key.add(String.valueOf(row.getAttribute(column)));
        }
        return key.toString();
    }

    /**
     * Rows grouped by {@link #seriesKey(DatasetRow)}, each group in period order.
     */
    public Map<String, List<DatasetRow>> groupBySeries() {
        Map<String, List<DatasetRow>> series = new LinkedHashMap<>();
        for (DatasetRow row : rows) {
            series.computeIfAbsent(seriesKey(row), k -> new ArrayList<>()).add(row);
        }
        return series;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        Dataset other = (Dataset) o;
        return frequency == other.frequency && passthroughColumns.equals(other.passthroughColumns)
                && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, passthroughColumns, rows);
    }

    @Override
    public String toString() {
        return "Dataset[" + frequency + ", " + rows.size() + " rows, columns=" + getColumns() + "]";
    }
}
