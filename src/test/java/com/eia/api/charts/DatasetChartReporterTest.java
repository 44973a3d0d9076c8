package com.eia.api.charts;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jfree.data.time.Day;
import org.jfree.data.time.Hour;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.junit.jupiter.api.Test;

import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;
import com.eia.api.query.Frequency;

public class DatasetChartReporterTest {

    @Test
    public void testOneSeriesPerIdentifier() {
        List<DatasetRow> rows = new ArrayList<>();
        OffsetDateTime start = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        for (int hour = 0; hour < 24; hour++) {
            rows.add(new DatasetRow(start.plusHours(hour), (double) hour, Map.of("subba", "PGAE")));
            rows.add(new DatasetRow(start.plusHours(hour), hour * 2.0, Map.of("subba", "SCE")));
        }
        Dataset dataset = new Dataset(Frequency.HOURLY, List.of("subba"), rows);

        TimeSeriesCollection collection = new DatasetChartReporter().toTimeSeriesCollection(dataset);

        assertEquals(2, collection.getSeriesCount());
        TimeSeries sce = collection.getSeries("SCE");
        assertNotNull(sce);
        assertEquals(24, sce.getItemCount());
        assertTrue(sce.getTimePeriod(0) instanceof Hour);
        assertEquals(46.0, sce.getValue(23).doubleValue());
    }

    @Test
    public void testDailyDatasetWithoutIdentifiersIsOneSeries() {
        List<DatasetRow> rows = new ArrayList<>();
        rows.add(new DatasetRow(LocalDate.of(2024, 1, 1), 1.0, null));
        rows.add(new DatasetRow(LocalDate.of(2024, 1, 2), null, null));
        Dataset dataset = new Dataset(Frequency.DAILY, List.of(), rows);

        TimeSeriesCollection collection = new DatasetChartReporter().toTimeSeriesCollection(dataset);

        assertEquals(1, collection.getSeriesCount());
        TimeSeries series = collection.getSeries(0);
        assertEquals(Dataset.VALUE, series.getKey());
        assertEquals(new Day(1, 1, 2024), series.getTimePeriod(0));
        assertNull(series.getValue(1));
    }
}
