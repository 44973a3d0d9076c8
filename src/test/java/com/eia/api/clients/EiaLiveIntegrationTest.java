package com.eia.api.clients;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.config.EiaClientConfig;
import com.eia.api.data.Dataset;
import com.eia.api.query.FacetSet;
import com.eia.api.query.Frequency;
import com.eia.api.query.TimeRange;

/**
 * Runs against the public API. Skipped unless an api key is configured
 * (EIA_API_KEY, -Deia.apiKey or eia-client.properties).
 */
public class EiaLiveIntegrationTest {

    private static final Logger logger = LoggerFactory.getLogger(EiaLiveIntegrationTest.class);

    private static EiaClientConfig config;

    @BeforeAll
    static void setupClass() {
        config = EiaClientConfig.load();
    }

    @Test
    public void testHourlySubBalancingAuthorityBackfill() throws IOException {
        Assumptions.assumeTrue(config.hasApiKey(), "EIA api key not configured, skipping live test");

        TimeRange range = TimeRange.ofHours(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 7, 23, 0));
        try (EiaApiClient client = new EiaApiClient(config.toBuilder().maxRowsPerRequest(500).build())) {
            Dataset dataset = client.data().fetch("electricity/rto/region-sub-ba-data/data/",
                    FacetSet.builder().facet("parent", "CISO").build(), range, Frequency.HOURLY);

            logger.info("Fetched {} rows, stats {}", dataset.size(), client.getApiStats());
            assertFalse(dataset.isEmpty());
            assertTrue(dataset.groupBySeries().size() > 1);
        }
    }

    @Test
    public void testDailyUnboundedFetch() throws IOException {
        Assumptions.assumeTrue(config.hasApiKey(), "EIA api key not configured, skipping live test");

        try (EiaApiClient client = new EiaApiClient(config)) {
            Dataset dataset = client.data().fetchUnbounded("electricity/rto/daily-region-data/data/",
                    FacetSet.builder().facet("respondent", "CISO").facet("type", "D").facet("timezone", "Pacific").build(),
                    LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31), Frequency.DAILY);

            assertEquals(31, dataset.size());
        }
    }
}
