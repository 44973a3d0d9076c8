package com.eia.api.data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.exceptions.EmptyResultException;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.exceptions.TypeMismatchException;
import com.eia.api.fetch.RawRowSet;
import com.eia.api.query.Frequency;

/**
 * Merges per-chunk row sets into one {@link Dataset}: concatenates in chunk order,
 * casts {@code value} to double, parses {@code period} and stable-sorts by period.
 */
public class DatasetAssembler {

    private static final Logger logger = LoggerFactory.getLogger(DatasetAssembler.class);

    /** The API truncates hourly periods to {@code YYYY-MM-DDTHH}. */
    private static final int TRUNCATED_HOUR_LENGTH = "yyyy-MM-ddTHH".length();

    private static final Comparator<DatasetRow> BY_PERIOD = Comparator.comparingLong(DatasetRow::sortKey);

    /**
     * @throws TypeMismatchException if a value or period cannot be parsed
     * @throws EmptyResultException  if no rows remain
     */
    public Dataset assemble(List<RawRowSet> rowSets, Frequency frequency) {
        if (frequency == null) {
            throw new InvalidArgumentException("Frequency is required to type the period column");
        }

        Set<String> passthroughColumns = new LinkedHashSet<>();
        List<DatasetRow> rows = new ArrayList<>();

        if (rowSets != null) {
            for (RawRowSet rowSet : rowSets) {
                if (rowSet == null) {
                    continue;
                }
                for (Map<String, Object> raw : rowSet.getRows()) {
                    rows.add(toRow(raw, frequency, passthroughColumns));
                }
            }
        }

        if (rows.isEmpty()) {
            throw new EmptyResultException("No data was retrieved from the API");
        }

        rows.sort(BY_PERIOD);
        logger.info("Assembled {} {} rows from {} chunk(s)", rows.size(), frequency,
                rowSets == null ? 0 : rowSets.size());
        return new Dataset(frequency, new ArrayList<>(passthroughColumns), rows);
    }

    private DatasetRow toRow(Map<String, Object> raw, Frequency frequency, Set<String> passthroughColumns) {
        Temporal period = parsePeriod(raw.get(Dataset.PERIOD), frequency);
        Double value = castValue(raw.get(Dataset.VALUE));

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String column = entry.getKey();
            if (Dataset.PERIOD.equals(column) || Dataset.VALUE.equals(column)) {
                continue;
            }
            passthroughColumns.add(column);
            attributes.put(column, entry.getValue());
        }
        return new DatasetRow(period, value, attributes);
    }

    /**
     * Plain decimal text only; Java literal forms such as {@code 12d} or hex are rejected.
     */
    static Double castValue(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            try {
                return new BigDecimal(((String) raw).trim()).doubleValue();
            } catch (NumberFormatException e) {
                throw new TypeMismatchException("Non-numeric value: '" + raw + "'", Dataset.VALUE, raw, e);
            }
        }
        throw new TypeMismatchException("Non-numeric value of type " + raw.getClass().getSimpleName(),
                Dataset.VALUE, raw);
    }

    static Temporal parsePeriod(Object raw, Frequency frequency) {
        if (!(raw instanceof String)) {
            throw new TypeMismatchException("Period must be a string, got: " + raw, Dataset.PERIOD, raw);
        }
        String text = ((String) raw).trim();
        try {
            switch (frequency) {
                case HOURLY:
                    if (text.length() == TRUNCATED_HOUR_LENGTH) {
                        text = text + ":00";
                    }
                    return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atOffset(ZoneOffset.UTC);
                case DAILY:
                    return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
                default:
                    throw new InvalidArgumentException("Unsupported frequency: " + frequency);
            }
        } catch (DateTimeParseException e) {
            throw new TypeMismatchException("Unparseable " + frequency + " period: '" + raw + "'",
                    Dataset.PERIOD, raw, e);
        }
    }
}
