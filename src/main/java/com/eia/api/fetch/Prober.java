package com.eia.api.fetch;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.clients.EiaTransport;
import com.eia.api.exceptions.EmptyResultException;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.query.Endpoint;
import com.eia.api.query.EndpointBuilder;
import com.eia.api.query.FacetSet;
import com.eia.api.query.Frequency;

/**
 * Discovers how many series a facet selection returns per period, so that chunks
 * can be sized to keep {@code periods * series <= maxRowsPerRequest}.
 */
public class Prober {

    private static final Logger logger = LoggerFactory.getLogger(Prober.class);

    private final EiaTransport transport;
    private final EndpointBuilder endpointBuilder;

    public Prober(EiaTransport transport, EndpointBuilder endpointBuilder) {
        this.transport = transport;
        this.endpointBuilder = endpointBuilder;
    }

    /**
     * Request the anchor period plus one and count the series present.
     *
     * @return number of concurrent series, at least 1
     * @throws EmptyResultException if the facet selection matches nothing
     */
    public int probe(String path, FacetSet facets, LocalDateTime anchor, Frequency frequency, String apiKey) {
        Endpoint probe = endpointBuilder.buildProbe(path, facets, anchor, frequency);
        logger.debug("Probing series count with {}", probe.getUrl());

        List<Map<String, Object>> rows = transport.getRows(probe.getUrl(), apiKey);
        if (rows == null || rows.isEmpty()) {
            throw new EmptyResultException("Probe returned no rows for facets " + facets
                    + " at " + probe.getRange() + "; the selection matches no data");
        }

        int seriesCount = countSeries(rows);
        logger.info("Number of time series requested: {}", seriesCount);
        return seriesCount;
    }

    /**
     * Largest number of rows sharing one period. The probe spans two periods, so the
     * raw row count would overstate the series count.
     */
    static int countSeries(List<Map<String, Object>> rows) {
        Map<String, Integer> rowsPerPeriod = new HashMap<>();
        int max = 0;
        for (Map<String, Object> row : rows) {
            String period = String.valueOf(row.get("period"));
            int count = rowsPerPeriod.merge(period, 1, Integer::sum);
            max = Math.max(max, count);
        }
        return max;
    }

    /**
     * {@code ceil(maxRowsPerRequest / seriesCount)}, rounded up to an even number and
     * capped at the largest even {@code int}.
     */
    public static int chunkSizeFor(int maxRowsPerRequest, int seriesCount) {
        if (maxRowsPerRequest <= 0) {
            throw new InvalidArgumentException("Max rows per request must be positive, got: " + maxRowsPerRequest);
        }
        if (seriesCount <= 0) {
            throw new InvalidArgumentException("Series count must be positive, got: " + seriesCount);
        }
        long chunkSize = ((long) maxRowsPerRequest + seriesCount - 1) / seriesCount;
        if (chunkSize % 2 != 0) {
            chunkSize++;
        }
        return (int) Math.min(chunkSize, Integer.MAX_VALUE - 1);
    }
}
