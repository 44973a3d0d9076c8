package com.eia.api.charts;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.text.DecimalFormat;
import java.text.SimpleDateFormat;
import java.util.TimeZone;

import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.title.TextTitle;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.time.TimeSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chart theme for dataset line charts
 */
public class ChartTheme {

    private static final Logger logger = LoggerFactory.getLogger(ChartTheme.class);

    private static final long HOUR_MILLIS = 60L * 60L * 1000L;

    private final Color backgroundColor;
    private final Color textColor;
    private final Color gridLineColor;
    private final Color[] seriesColors;

    public ChartTheme(boolean darkMode) {
        if (darkMode) {
            this.backgroundColor = new Color(30, 30, 30);
            this.textColor = new Color(230, 230, 230);
            this.gridLineColor = new Color(60, 60, 60);
            this.seriesColors = new Color[] {
                new Color(0, 149, 255),
                new Color(255, 98, 37),
                new Color(255, 200, 47),
                new Color(177, 70, 194),
                new Color(132, 235, 52),
                new Color(99, 217, 255)
            };
        } else {
            this.backgroundColor = Color.white;
            this.textColor = Color.black;
            this.gridLineColor = Color.lightGray;
            this.seriesColors = new Color[] {
                new Color(0, 114, 189),
                new Color(217, 83, 25),
                new Color(237, 177, 32),
                new Color(126, 47, 142),
                new Color(119, 172, 48),
                new Color(77, 190, 238)
            };
        }
    }

    public void applyTo(JFreeChart chart, TimeSeriesCollection dataset) {
        chart.setPadding(new RectangleInsets(2, 2, 2, 2));
        chart.setBackgroundPaint(backgroundColor);

        TextTitle title = chart.getTitle();
        if (title != null) {
            title.setFont(new Font("SansSerif", Font.BOLD, 12));
            title.setPaint(textColor);
        }
        if (chart.getLegend() != null) {
            chart.getLegend().setBackgroundPaint(backgroundColor);
            chart.getLegend().setItemPaint(textColor);
        }

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(backgroundColor);
        plot.setDomainGridlinePaint(gridLineColor);
        plot.setRangeGridlinePaint(gridLineColor);
        plot.setDomainGridlinesVisible(true);
        plot.setRangeGridlinesVisible(true);

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        for (int i = 0; i < dataset.getSeriesCount(); i++) {
            renderer.setSeriesPaint(i, seriesColors[i % seriesColors.length]);
            renderer.setSeriesStroke(i, new BasicStroke(1.0f));
            renderer.setSeriesShapesVisible(i, false);
        }
        plot.setRenderer(renderer);

        configureDateAxis((DateAxis) plot.getDomainAxis(), dataset);

        NumberAxis valueAxis = (NumberAxis) plot.getRangeAxis();
        valueAxis.setTickLabelFont(new Font("SansSerif", Font.PLAIN, 9));
        valueAxis.setTickLabelPaint(textColor);
        valueAxis.setLabelPaint(textColor);
        valueAxis.setNumberFormatOverride(new DecimalFormat("#,##0.##"));
        valueAxis.setAutoRangeIncludesZero(true);
    }

    private void configureDateAxis(DateAxis dateAxis, TimeSeriesCollection dataset) {
        SimpleDateFormat dateFormat;
        if (dataset.getSeriesCount() > 0) {
            double span = dataset.getDomainUpperBound(false) - dataset.getDomainLowerBound(false);
            long spanHours = (long) (span / HOUR_MILLIS);
            if (spanHours <= 24) {
                dateFormat = new SimpleDateFormat("HH:mm");
            } else if (spanHours <= 7 * 24) {
                dateFormat = new SimpleDateFormat("MM/dd HH:mm");
            } else {
                dateFormat = new SimpleDateFormat("yyyy-MM-dd");
            }
            logger.debug("Date axis format {} for {} hour span", dateFormat.toPattern(), spanHours);
        } else {
            dateFormat = new SimpleDateFormat("yyyy-MM-dd");
        }
        dateFormat.setTimeZone(TimeZone.getTimeZone("UTC"));

        dateAxis.setTimeZone(TimeZone.getTimeZone("UTC"));
        dateAxis.setDateFormatOverride(dateFormat);
        dateAxis.setTickLabelFont(new Font("SansSerif", Font.PLAIN, 9));
        dateAxis.setTickLabelPaint(textColor);
        dateAxis.setLabelPaint(textColor);
        dateAxis.setLowerMargin(0.01);
        dateAxis.setUpperMargin(0.01);
    }
}
