package com.eia.api.cli.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.eia.api.cli.EiaCliMain.OutputFormat;
import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;
import com.eia.api.query.Frequency;

public class OutputFormatterTest {

    private static final Dataset DATASET = new Dataset(Frequency.DAILY, List.of("respondent"), List.of(
            new DatasetRow(LocalDate.of(2024, 1, 1), 10.5, Map.of("respondent", "CISO")),
            new DatasetRow(LocalDate.of(2024, 1, 2), null, Map.of("respondent", "CISO"))));

    @Test
    public void testTableOutput() {
        String output = print(OutputFormat.TABLE);

        assertTrue(output.contains("PERIOD"));
        assertTrue(output.contains("RESPONDENT"));
        assertTrue(output.contains("2024-01-01"));
        assertTrue(output.contains("10.5"));
        assertTrue(output.contains("Rows: 2"));
    }

    @Test
    public void testCsvOutput() {
        String output = print(OutputFormat.CSV);

        assertEquals("period,value,respondent\n2024-01-01,10.5,CISO\n2024-01-02,,CISO\n", output);
    }

    @Test
    public void testJsonOutput() {
        String output = print(OutputFormat.JSON);

        assertTrue(output.contains("\"period\" : \"2024-01-01\""));
        assertTrue(output.contains("\"value\" : null"));
        assertTrue(output.contains("\"respondent\" : \"CISO\""));
    }

    private static String print(OutputFormat format) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        OutputFormatter.printDataset(DATASET, format, out);
        out.flush();
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
