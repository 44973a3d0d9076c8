package com.eia.api.cli.commands;

import java.io.File;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.charts.DatasetChartReporter;
import com.eia.api.cli.EiaCliMain;
import com.eia.api.cli.utils.OutputFormatter;
import com.eia.api.clients.EiaApiClient;
import com.eia.api.config.EiaClientConfig;
import com.eia.api.csv.DatasetCsvExporter;
import com.eia.api.data.Dataset;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.query.FacetSet;
import com.eia.api.query.FacetValue;
import com.eia.api.query.Frequency;
import com.eia.api.query.PageControls;
import com.eia.api.query.TimeRange;
import com.eia.api.storage.DatasetStorage;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Fetches a time range from one data route and prints, exports or stores it
 */
@Command(
    name = "fetch",
    description = "Fetch a time series range, chunked to the per-request row limit",
    mixinStandardHelpOptions = true
)
public class FetchCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(FetchCommand.class);

    @ParentCommand
    private EiaCliMain parent;

    @Parameters(index = "0", description = "Data route, e.g. electricity/rto/region-sub-ba-data/data/")
    private String path;

    @Option(names = {"-f", "--facet"}, description = "Facet filter name=value (repeatable)")
    private List<String> facets = new ArrayList<>();

    @Option(names = {"--start"},
            description = "Start period: YYYY-MM-DD, or YYYY-MM-DDTHH for hourly data (optional with --unbounded)")
    private String start;

    @Option(names = {"--end"},
            description = "End period (inclusive): YYYY-MM-DD, or YYYY-MM-DDTHH for hourly data (optional with --unbounded)")
    private String end;

    @Option(names = {"--frequency"}, defaultValue = "hourly", description = "hourly or daily (default: hourly)")
    private String frequency;

    @Option(names = {"--max-rows"}, description = "Rows per request (overrides config)")
    private Integer maxRows;

    @Option(names = {"--concurrency"}, description = "Parallel requests (overrides config)")
    private Integer concurrency;

    @Option(names = {"--unbounded"}, description = "Single request, no probing or chunking")
    private boolean unbounded;

    @Option(names = {"--length"}, description = "Page length for --unbounded requests")
    private Integer length;

    @Option(names = {"--offset"}, description = "Page offset for --unbounded requests")
    private Integer offset;

    @Option(names = {"--csv"}, description = "Write the dataset to this CSV file")
    private File csvFile;

    @Option(names = {"--svg"}, description = "Write a line chart of the dataset to this SVG file")
    private File svgFile;

    @Option(names = {"--mongo-uri"}, description = "Store the dataset in MongoDB at this connection string")
    private String mongoUri;

    @Option(names = {"--database"}, defaultValue = "eia", description = "MongoDB database (default: eia)")
    private String database;

    @Option(names = {"--collection"}, defaultValue = "eia_data",
            description = "MongoDB time-series collection (default: eia_data)")
    private String collection;

    @Option(names = {"--quiet"}, description = "Do not print the dataset")
    private boolean quiet;

    @Override
    public Integer call() throws Exception {
        EiaClientConfig config = applyOverrides(parent.loadConfig());
        if (!config.hasApiKey()) {
            System.err.println("Error: no EIA API key configured. Use --apiKey, "
                    + EiaClientConfig.ENV_API_KEY + " or the apiKey property.");
            return 1;
        }

        Frequency freq = Frequency.fromLabel(frequency);
        LocalDateTime startBound = start == null ? null : parseBound(start, freq);
        LocalDateTime endBound = end == null ? null : parseBound(end, freq);
        FacetSet facetSet = parseFacets(facets);
        if (!unbounded && (startBound == null || endBound == null)) {
            throw new InvalidArgumentException("--start and --end are required unless --unbounded is given");
        }

        Dataset dataset;
        try (EiaApiClient client = new EiaApiClient(config)) {
            if (unbounded) {
                dataset = client.data().fetchUnbounded(path, facetSet, startBound, endBound, freq,
                        PageControls.of(length, offset));
            } else {
                TimeRange range = TimeRange.of(startBound, endBound, freq.getGranularity());
                dataset = client.data().fetch(path, facetSet, range, freq, config.getMaxRowsPerRequest());
            }
            logger.info("Fetched {} rows, API stats: {}", dataset.size(), client.getApiStats());
        }

        if (!quiet) {
            OutputFormatter.printDataset(dataset, parent.getFormat());
        }
        if (csvFile != null) {
            new DatasetCsvExporter().export(dataset, csvFile.getPath());
            System.out.println("CSV written to " + csvFile.getAbsolutePath());
        }
        if (svgFile != null) {
            new DatasetChartReporter().writeSvg(dataset, path, svgFile);
            System.out.println("Chart written to " + svgFile.getAbsolutePath());
        }
        if (mongoUri != null) {
            try (DatasetStorage storage = new DatasetStorage(mongoUri, database, collection)) {
                int saved = storage.save(dataset);
                System.out.println("Saved " + saved + " rows to " + database + "." + collection);
            }
        }
        return 0;
    }

    private EiaClientConfig applyOverrides(EiaClientConfig config) {
        EiaClientConfig.Builder builder = config.toBuilder();
        if (maxRows != null) {
            builder.maxRowsPerRequest(maxRows);
        }
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        return builder.build();
    }

    /**
     * Parse repeated {@code name=value} options; a name given more than once
     * becomes a multi-valued facet.
     */
    public static FacetSet parseFacets(List<String> options) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        if (options != null) {
            for (String option : options) {
                int separator = option == null ? -1 : option.indexOf('=');
                if (separator <= 0 || separator == option.length() - 1) {
                    throw new InvalidArgumentException("Facet must be name=value, got: " + option);
                }
                String name = option.substring(0, separator).trim();
                String value = option.substring(separator + 1).trim();
                grouped.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            }
        }

        FacetSet.Builder builder = FacetSet.builder();
        for (Map.Entry<String, List<String>> entry : grouped.entrySet()) {
            List<String> values = entry.getValue();
            builder.facet(entry.getKey(), values.size() == 1
                    ? FacetValue.single(values.get(0))
                    : FacetValue.multiple(values));
        }
        return builder.build();
    }

    /**
     * {@code YYYY-MM-DD} is accepted for both frequencies (midnight for hourly data);
     * {@code YYYY-MM-DDTHH} only for hourly data.
     */
    public static LocalDateTime parseBound(String value, Frequency frequency) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException("Range bound must not be blank");
        }
        String text = value.trim();
        try {
            if (text.length() == "yyyy-MM-dd".length()) {
                return LocalDate.parse(text).atStartOfDay();
            }
            if (frequency != Frequency.HOURLY) {
                throw new InvalidArgumentException("Daily bounds must be YYYY-MM-DD, got: " + value);
            }
            if (text.length() == "yyyy-MM-ddTHH".length()) {
                text = text + ":00";
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Cannot parse range bound: " + value, e);
        }
    }
}
