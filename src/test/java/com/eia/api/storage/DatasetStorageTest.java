package com.eia.api.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;
import com.eia.api.query.Frequency;

public class DatasetStorageTest {

    @Test
    public void testHourlyRowsBecomeTimeSeriesDocuments() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("parent", "CISO");
        attributes.put("subba", "SDGE");
        OffsetDateTime period = OffsetDateTime.of(2024, 1, 1, 5, 0, 0, 0, ZoneOffset.UTC);
        Dataset dataset = new Dataset(Frequency.HOURLY, Arrays.asList("parent", "subba"),
                List.of(new DatasetRow(period, 2100.0, attributes)));

        List<Document> documents = DatasetStorage.toDocuments(dataset);

        assertEquals(1, documents.size());
        Document document = documents.get(0);
        assertEquals(Date.from(period.toInstant()), document.get(DatasetStorage.TIME_FIELD));
        assertEquals(2100.0, document.getDouble(DatasetStorage.VALUE_FIELD));
        Document metadata = document.get(DatasetStorage.META_FIELD, Document.class);
        assertEquals("hourly", metadata.getString(DatasetStorage.FREQUENCY_FIELD));
        assertEquals("SDGE", metadata.getString("subba"));
        assertEquals("CISO", metadata.getString("parent"));
    }

    @Test
    public void testDailyRowsAnchorAtUtcMidnightAndKeepNullValues() {
        Dataset dataset = new Dataset(Frequency.DAILY, List.of(),
                List.of(new DatasetRow(LocalDate.of(2024, 2, 29), null, null)));

        Document document = DatasetStorage.toDocuments(dataset).get(0);

        assertEquals(Date.from(LocalDate.of(2024, 2, 29).atStartOfDay(ZoneOffset.UTC).toInstant()),
                document.get(DatasetStorage.TIME_FIELD));
        assertTrue(document.containsKey(DatasetStorage.VALUE_FIELD));
        assertNull(document.get(DatasetStorage.VALUE_FIELD));
    }

    @Test
    public void testSaveToLiveMongo() {
        String uri = System.getenv("MONGODB_URI");
        Assumptions.assumeTrue(uri != null && !uri.isEmpty(), "MONGODB_URI not set, skipping live storage test");

        Dataset dataset = new Dataset(Frequency.DAILY, List.of("respondent"), List.of(
                new DatasetRow(LocalDate.of(2024, 1, 1), 1.0, Map.of("respondent", "CISO")),
                new DatasetRow(LocalDate.of(2024, 1, 2), 2.0, Map.of("respondent", "CISO"))));

        String collection = "eia_test_" + System.currentTimeMillis();
        try (DatasetStorage storage = new DatasetStorage(uri, "eia_test", collection)) {
            assertEquals(2, storage.save(dataset));
            assertEquals(2, storage.count());
        }
    }
}
