package com.eia.api.cli.utils;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.eia.api.cli.EiaCliMain.OutputFormat;
import com.eia.api.csv.DatasetCsvExporter;
import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Utility class for formatting CLI output in various formats
 */
public class OutputFormatter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final int MAX_COLUMN_WIDTH = 40;

    public static void printDataset(Dataset dataset, OutputFormat format) {
        printDataset(dataset, format, System.out);
    }

    public static void printDataset(Dataset dataset, OutputFormat format, PrintStream out) {
        switch (format) {
            case JSON:
                printJson(toRecords(dataset), out);
                break;
            case CSV:
                printDatasetCsv(dataset, out);
                break;
            case TABLE:
            default:
                printDatasetTable(dataset, out);
                break;
        }
    }

    private static void printDatasetTable(Dataset dataset, PrintStream out) {
        List<String> columns = dataset.getColumns();
        List<List<String>> cells = new ArrayList<>(dataset.size());
        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).length();
        }

        for (DatasetRow row : dataset.getRows()) {
            List<String> line = new ArrayList<>(columns.size());
            line.add(DatasetCsvExporter.formatPeriod(row.getPeriod()));
            line.add(row.getValue() == null ? "" : String.valueOf(row.getValue()));
            for (String column : dataset.getPassthroughColumns()) {
                Object cell = row.getAttribute(column);
                line.add(cell == null ? "" : cell.toString());
            }
            for (int i = 0; i < line.size(); i++) {
                widths[i] = Math.min(MAX_COLUMN_WIDTH, Math.max(widths[i], line.get(i).length()));
            }
            cells.add(line);
        }

        StringBuilder format = new StringBuilder();
        int totalWidth = 0;
        for (int width : widths) {
            format.append("%-").append(width).append("s ");
            totalWidth += width + 1;
        }
        String rowFormat = format.toString().trim() + "%n";

        out.println();
        out.printf(rowFormat, upperCase(columns).toArray());
        out.println("─".repeat(Math.max(0, totalWidth - 1)));
        for (List<String> line : cells) {
            List<String> truncated = new ArrayList<>(line.size());
            for (int i = 0; i < line.size(); i++) {
                truncated.add(truncate(line.get(i), widths[i]));
            }
            out.printf(rowFormat, truncated.toArray());
        }
        out.println();
        out.println("Rows: " + dataset.size());
    }

    private static void printDatasetCsv(Dataset dataset, PrintStream out) {
        try {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            new DatasetCsvExporter().write(dataset, writer);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<Map<String, Object>> toRecords(Dataset dataset) {
        List<Map<String, Object>> records = new ArrayList<>(dataset.size());
        for (DatasetRow row : dataset.getRows()) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put(Dataset.PERIOD, DatasetCsvExporter.formatPeriod(row.getPeriod()));
            record.put(Dataset.VALUE, row.getValue());
            record.putAll(row.getAttributes());
            records.add(record);
        }
        return records;
    }

    private static void printJson(Object object, PrintStream out) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object);
            out.println(json);
        } catch (Exception e) {
            System.err.println("Error formatting JSON: " + e.getMessage());
        }
    }

    private static List<String> upperCase(List<String> values) {
        List<String> upper = new ArrayList<>(values.size());
        for (String value : values) {
            upper.add(value.toUpperCase());
        }
        return upper;
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return "";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength - 3) + "...";
    }
}
