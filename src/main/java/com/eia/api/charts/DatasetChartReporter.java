package com.eia.api.charts;

import java.awt.Rectangle;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.data.time.Day;
import org.jfree.data.time.Hour;
import org.jfree.data.time.RegularTimePeriod;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.jfree.graphics2d.svg.SVGGraphics2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;

/**
 * Renders a dataset as an SVG line chart of value over period, one line per series.
 */
public class DatasetChartReporter {

    private static final Logger logger = LoggerFactory.getLogger(DatasetChartReporter.class);

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final int chartWidth;
    private final int chartHeight;
    private final ChartTheme chartTheme;

    public DatasetChartReporter() {
        this(900, 400, false);
    }

    public DatasetChartReporter(int chartWidth, int chartHeight, boolean darkMode) {
        this.chartWidth = chartWidth;
        this.chartHeight = chartHeight;
        this.chartTheme = new ChartTheme(darkMode);
    }

    /**
     * One {@link TimeSeries} per series key, null values kept as gaps.
     */
    public TimeSeriesCollection toTimeSeriesCollection(Dataset dataset) {
        TimeSeriesCollection collection = new TimeSeriesCollection(UTC);
        for (Map.Entry<String, List<DatasetRow>> entry : dataset.groupBySeries().entrySet()) {
            TimeSeries series = new TimeSeries(entry.getKey());
            for (DatasetRow row : entry.getValue()) {
                series.addOrUpdate(toTimePeriod(row), row.getValue());
            }
            collection.addSeries(series);
        }
        return collection;
    }

    public JFreeChart createChart(Dataset dataset, String title) {
        TimeSeriesCollection collection = toTimeSeriesCollection(dataset);
        logger.info("Creating chart '{}': {} series, {} rows", title, collection.getSeriesCount(), dataset.size());

        JFreeChart chart = ChartFactory.createTimeSeriesChart(
                title,
                null,
                Dataset.VALUE,
                collection,
                collection.getSeriesCount() > 1,
                false,
                false);
        chartTheme.applyTo(chart, collection);
        return chart;
    }

    public void writeSvg(Dataset dataset, String title, File file) throws IOException {
        JFreeChart chart = createChart(dataset, title);

        SVGGraphics2D g2 = new SVGGraphics2D(chartWidth, chartHeight);
        chart.draw(g2, new Rectangle(0, 0, chartWidth, chartHeight));
        String svgElement = g2.getSVGElement();

        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) {
            parent.mkdirs();
        }
        try (FileOutputStream fos = new FileOutputStream(file);
             OutputStreamWriter osw = new OutputStreamWriter(fos, StandardCharsets.UTF_8)) {
            osw.write(svgElement);
        }
        logger.info("Chart written to {}", file.getAbsolutePath());
    }

    private static RegularTimePeriod toTimePeriod(DatasetRow row) {
        if (row.getPeriod() instanceof LocalDate) {
            LocalDate date = (LocalDate) row.getPeriod();
            return new Day(date.getDayOfMonth(), date.getMonthValue(), date.getYear());
        }
        return new Hour(Date.from(row.toInstant()), UTC, Locale.ROOT);
    }
}
