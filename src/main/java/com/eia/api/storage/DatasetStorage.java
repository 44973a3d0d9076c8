package com.eia.api.storage;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.data.Dataset;
import com.eia.api.data.DatasetRow;
import com.eia.api.query.Frequency;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CreateCollectionOptions;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.TimeSeriesGranularity;
import com.mongodb.client.model.TimeSeriesOptions;

/**
 * Stores datasets in a MongoDB time-series collection. Each row becomes one
 * document with the period as time field and the passthrough columns, plus the
 * frequency, under {@value #META_FIELD}.
 */
public class DatasetStorage implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DatasetStorage.class);

    public static final String TIME_FIELD = "period";
    public static final String VALUE_FIELD = "value";
    public static final String META_FIELD = "metadata";
    public static final String FREQUENCY_FIELD = "frequency";

    private static final int BATCH_SIZE = 1000;

    private final MongoClient mongoClient;
    private final MongoDatabase database;
    private final String collectionName;
    private MongoCollection<Document> collection;

    /**
     * @param connectionString MongoDB connection string
     * @param databaseName     database name to use
     * @param collectionName   collection name to use, created as a time-series collection if missing
     */
    public DatasetStorage(String connectionString, String databaseName, String collectionName) {
        logger.debug("Connecting to MongoDB at {}...", connectionString);
        long startTime = System.currentTimeMillis();
        this.mongoClient = MongoClients.create(connectionString);
        this.database = mongoClient.getDatabase(databaseName);
        this.collectionName = collectionName;
        logger.info("MongoDB connection established in {}ms", System.currentTimeMillis() - startTime);

        initializeCollection();
        logger.info("Initialized dataset storage with database: {}, collection: {}", databaseName, collectionName);
    }

    private void initializeCollection() {
        boolean collectionExists = database.listCollectionNames().into(new ArrayList<>()).contains(collectionName);

        if (!collectionExists) {
            logger.info("Creating timeseries collection: {}", collectionName);
            TimeSeriesOptions timeSeriesOptions = new TimeSeriesOptions(TIME_FIELD)
                    .metaField(META_FIELD)
                    .granularity(TimeSeriesGranularity.HOURS);
            database.createCollection(collectionName,
                    new CreateCollectionOptions().timeSeriesOptions(timeSeriesOptions));
        } else {
            logger.info("Using existing collection: {}", collectionName);
        }
        collection = database.getCollection(collectionName);
    }

    /**
     * Insert all rows of the dataset.
     *
     * @return number of documents inserted
     */
    public int save(Dataset dataset) {
        List<Document> documents = toDocuments(dataset);
        int inserted = 0;
        for (int from = 0; from < documents.size(); from += BATCH_SIZE) {
            List<Document> batch = documents.subList(from, Math.min(from + BATCH_SIZE, documents.size()));
            collection.insertMany(batch, new InsertManyOptions().ordered(false));
            inserted += batch.size();
            logger.debug("Inserted {} of {} documents into {}", inserted, documents.size(), collectionName);
        }
        logger.info("Saved {} rows to collection {}", inserted, collectionName);
        return inserted;
    }

    public long count() {
        return collection.countDocuments();
    }

    public static List<Document> toDocuments(Dataset dataset) {
        Frequency frequency = dataset.getFrequency();
        List<Document> documents = new ArrayList<>(dataset.size());
        for (DatasetRow row : dataset.getRows()) {
            Document metadata = new Document(FREQUENCY_FIELD, frequency.getLabel());
            for (Map.Entry<String, Object> attribute : row.getAttributes().entrySet()) {
                metadata.append(attribute.getKey(), attribute.getValue());
            }
            documents.add(new Document(TIME_FIELD, Date.from(row.toInstant()))
                    .append(VALUE_FIELD, row.getValue())
                    .append(META_FIELD, metadata));
        }
        return documents;
    }

    @Override
    public void close() {
        if (mongoClient != null) {
            mongoClient.close();
            logger.info("MongoDB connection closed");
        }
    }
}
