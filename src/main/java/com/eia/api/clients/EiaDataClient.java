package com.eia.api.clients;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.config.EiaClientConfig;
import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetAssembler;
import com.eia.api.exceptions.EmptyResultException;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.exceptions.TransportFailureException;
import com.eia.api.exceptions.TypeMismatchException;
import com.eia.api.fetch.ConcurrentFetcher;
import com.eia.api.fetch.Prober;
import com.eia.api.fetch.RawRowSet;
import com.eia.api.fetch.RetryPolicy;
import com.eia.api.query.Chunk;
import com.eia.api.query.ChunkPlanner;
import com.eia.api.query.Endpoint;
import com.eia.api.query.EndpointBuilder;
import com.eia.api.query.FacetSet;
import com.eia.api.query.Frequency;
import com.eia.api.query.PageControls;
import com.eia.api.query.TimeRange;

/**
 * Time-series backfill over the EIA data routes. A {@link #fetch} call probes the
 * series count, plans request-sized chunks, fetches them concurrently and
 * assembles one period-sorted {@link Dataset}. Either the complete dataset is
 * returned or a single {@link com.eia.api.exceptions.EiaApiException} is thrown.
 */
public class EiaDataClient {

    private static final Logger logger = LoggerFactory.getLogger(EiaDataClient.class);

    private final EiaTransport transport;
    private final EndpointBuilder endpointBuilder;
    private final Prober prober;
    private final ConcurrentFetcher fetcher;
    private final DatasetAssembler assembler;
    private final String apiKey;
    private final int defaultMaxRowsPerRequest;

    public EiaDataClient(EiaTransport transport, EiaClientConfig config) {
        this(transport, new EndpointBuilder(config.getBaseUrl()), config.getApiKey(),
                config.getConcurrency(), config.getRetryPolicy(), config.getMaxRowsPerRequest());
    }

    public EiaDataClient(EiaTransport transport, EndpointBuilder endpointBuilder, String apiKey,
            int concurrency, RetryPolicy retryPolicy, int defaultMaxRowsPerRequest) {
        if (transport == null || endpointBuilder == null) {
            throw new InvalidArgumentException("Transport and endpoint builder are required");
        }
        if (defaultMaxRowsPerRequest <= 0) {
            throw new InvalidArgumentException("Max rows per request must be positive, got: "
                    + defaultMaxRowsPerRequest);
        }
        this.transport = transport;
        this.endpointBuilder = endpointBuilder;
        this.prober = new Prober(transport, endpointBuilder);
        this.fetcher = new ConcurrentFetcher(transport, concurrency, retryPolicy);
        this.assembler = new DatasetAssembler();
        this.apiKey = apiKey;
        this.defaultMaxRowsPerRequest = defaultMaxRowsPerRequest;
    }

    public Dataset fetch(String path, FacetSet facets, TimeRange range, Frequency frequency) {
        return fetch(path, facets, range, frequency, defaultMaxRowsPerRequest);
    }

    /**
     * Daily bounds; for hourly data the range runs from midnight of {@code start}
     * to midnight of {@code end}.
     */
    public Dataset fetch(String path, FacetSet facets, LocalDate start, LocalDate end, Frequency frequency,
            int maxRowsPerRequest) {
        return fetch(path, facets, rangeOf(start, end, frequency), frequency, maxRowsPerRequest);
    }

    public Dataset fetch(String path, FacetSet facets, LocalDateTime start, LocalDateTime end,
            Frequency frequency, int maxRowsPerRequest) {
        return fetch(path, facets, rangeOf(start, end, frequency), frequency, maxRowsPerRequest);
    }

    /**
     * Chunked backfill of {@code range}.
     *
     * @param maxRowsPerRequest row budget shared by all series in one request
     * @throws InvalidArgumentException   on bad input, before any request is issued
     * @throws EmptyResultException       if the probe or the final dataset has no rows
     * @throws TransportFailureException  if any chunk request fails
     * @throws TypeMismatchException      if a value or period does not parse
     */
    public Dataset fetch(String path, FacetSet facets, TimeRange range, Frequency frequency,
            int maxRowsPerRequest) {
        validate(path, range, frequency);
        if (maxRowsPerRequest <= 0) {
            throw new InvalidArgumentException("Max rows per request must be positive, got: " + maxRowsPerRequest);
        }
        FacetSet effectiveFacets = facets == null ? FacetSet.empty() : facets;

        int seriesCount = prober.probe(path, effectiveFacets, range.getStart(), frequency, apiKey);
        int periodsPerChunk = Prober.chunkSizeFor(maxRowsPerRequest, seriesCount);
        List<Chunk> chunks = ChunkPlanner.plan(range, periodsPerChunk);

        logger.info("Fetching {} from {} to {}: {} series, {} {} period(s) per chunk, {} chunk(s)",
                path, range.formatStart(), range.formatEnd(), seriesCount, periodsPerChunk,
                frequency.getLabel(), chunks.size());

        List<Endpoint> endpoints = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            endpoints.add(endpointBuilder.build(path, effectiveFacets, chunk.getRange(), frequency));
        }

        List<RawRowSet> rowSets = fetcher.fetchAll(endpoints, apiKey);
        return assembler.assemble(rowSets, frequency);
    }

    public Dataset fetchUnbounded(String path, FacetSet facets, TimeRange range, Frequency frequency) {
        return fetchUnbounded(path, facets, range, frequency, PageControls.none());
    }

    /**
     * Either bound may be null, in which case it is left out of the request.
     */
    public Dataset fetchUnbounded(String path, FacetSet facets, LocalDate start, LocalDate end,
            Frequency frequency) {
        return fetchUnbounded(path, facets, start == null ? null : start.atStartOfDay(),
                end == null ? null : end.atStartOfDay(), frequency, PageControls.none());
    }

    /**
     * One request for the whole range, no probing or chunking. Rows beyond the
     * server's page size are not fetched; use {@code pageControls} to page explicitly.
     *
     * @param range bounds of the request, or null to send neither {@code start} nor {@code end}
     */
    public Dataset fetchUnbounded(String path, FacetSet facets, TimeRange range, Frequency frequency,
            PageControls pageControls) {
        validateRequest(path, frequency);
        if (range != null) {
            validateGranularity(range, frequency);
        }
        return fetchSingle(endpointBuilder.build(path, facets, range, frequency, pageControls), frequency);
    }

    /**
     * Open-ended single request; {@code start} and {@code end} are each optional.
     */
    public Dataset fetchUnbounded(String path, FacetSet facets, LocalDateTime start, LocalDateTime end,
            Frequency frequency, PageControls pageControls) {
        validateRequest(path, frequency);
        return fetchSingle(endpointBuilder.build(path, facets, start, end, frequency, pageControls), frequency);
    }

    private Dataset fetchSingle(Endpoint endpoint, Frequency frequency) {
        logger.info("Fetching {} from {} to {} in a single request", endpoint.getPath(),
                endpoint.getStart() == null ? "(open)" : endpoint.getStart(),
                endpoint.getEnd() == null ? "(open)" : endpoint.getEnd());

        List<Map<String, Object>> rows = transport.getRows(endpoint.getUrl(), apiKey);
        RawRowSet rowSet = new RawRowSet(0, endpoint.getUrl(), rows);
        return assembler.assemble(Collections.singletonList(rowSet), frequency);
    }

    public int getDefaultMaxRowsPerRequest() {
        return defaultMaxRowsPerRequest;
    }

    public EndpointBuilder getEndpointBuilder() {
        return endpointBuilder;
    }

    private static void validate(String path, TimeRange range, Frequency frequency) {
        validateRequest(path, frequency);
        if (range == null) {
            throw new InvalidArgumentException("Time range is required");
        }
        validateGranularity(range, frequency);
    }

    private static void validateRequest(String path, Frequency frequency) {
        if (path == null || path.trim().isEmpty()) {
            throw new InvalidArgumentException("API path must not be blank");
        }
        if (frequency == null) {
            throw new InvalidArgumentException("Frequency is required");
        }
    }

    private static void validateGranularity(TimeRange range, Frequency frequency) {
        if (range.getGranularity() != frequency.getGranularity()) {
            throw new InvalidArgumentException("Range granularity " + range.getGranularity()
                    + " does not match frequency " + frequency.getLabel());
        }
    }

    private static TimeRange rangeOf(LocalDate start, LocalDate end, Frequency frequency) {
        if (start == null || end == null) {
            throw new InvalidArgumentException("Range bounds must not be null");
        }
        return rangeOf(start.atStartOfDay(), end.atStartOfDay(), frequency);
    }

    private static TimeRange rangeOf(LocalDateTime start, LocalDateTime end, Frequency frequency) {
        if (frequency == null) {
            throw new InvalidArgumentException("Frequency is required");
        }
        return TimeRange.of(start, end, frequency.getGranularity());
    }
}
