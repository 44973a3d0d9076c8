package com.eia.api.csv;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;

/**
 * Exports a {@link Dataset} to CSV: {@code period,value} followed by the
 * passthrough columns in dataset order. Null values are written as empty cells.
 */
public class DatasetCsvExporter {

    private static final Logger logger = LoggerFactory.getLogger(DatasetCsvExporter.class);

    private static final DateTimeFormatter HOURLY_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final DateTimeFormatter DAILY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    /**
     * Export the dataset to a CSV file
     *
     * @param dataset  rows to export
     * @param filename the name of the CSV file to create
     */
    public void export(Dataset dataset, String filename) throws IOException {
        try (FileWriter writer = new FileWriter(filename, StandardCharsets.UTF_8)) {
            write(dataset, writer);
        }
        logger.info("Exported {} rows to {}", dataset.size(), filename);
    }

    public void write(Dataset dataset, Writer writer) throws IOException {
        List<String> columns = dataset.getColumns();
        writer.write(String.join(",", columns) + "\n");

        List<String> passthrough = dataset.getPassthroughColumns();
        for (DatasetRow row : dataset.getRows()) {
            StringBuilder line = new StringBuilder(formatPeriod(row.getPeriod()));
            line.append(',');
            if (row.getValue() != null) {
                line.append(row.getValue());
            }
            for (String column : passthrough) {
                line.append(',');
                Object cell = row.getAttribute(column);
                if (cell != null) {
                    line.append(escape(cell.toString()));
                }
            }
            writer.write(line.append('\n').toString());
        }
    }

    public static String formatPeriod(Temporal period) {
        if (period instanceof OffsetDateTime) {
            return HOURLY_FORMAT.format(period);
        }
        if (period instanceof LocalDate) {
            return DAILY_FORMAT.format(period);
        }
        return String.valueOf(period);
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0
                && value.indexOf('\r') < 0) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
