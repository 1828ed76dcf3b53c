package com.tresComas.financialData.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.time.Clock;
import java.util.Map;

/**
 * MongoDB-backed store. Each save is a single replaceOne with upsert, so a re-fetched
 * document replaces the stored one by key.
 */
@Slf4j
public class MongoFinancialDataStore extends AbstractFinancialDataStore {

    private final String uri;
    private final String databaseName;
    private final Map<String, String> collectionNames;

    private MongoClient client;
    private MongoDatabase database;

    /**
     * @param collectionNames Physical collection name per logical collection
     *                        ({@link #STOCK_DATA}, {@link #SEC_FILINGS}, {@link #OPTIONS_DATA})
     */
    public MongoFinancialDataStore(String uri, String databaseName, Map<String, String> collectionNames,
                                   ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
        this.uri = uri;
        this.databaseName = databaseName;
        this.collectionNames = Map.copyOf(collectionNames);
    }

    /**
     * Store over an already connected database. {@link #open()} is a no-op and
     * {@link #close()} only detaches from the database.
     */
    MongoFinancialDataStore(MongoDatabase database, Map<String, String> collectionNames,
                            ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
        this.uri = null;
        this.databaseName = database.getName();
        this.collectionNames = Map.copyOf(collectionNames);
        this.database = database;
    }

    @Override
    public synchronized void open() {
        if (database != null) {
            return;
        }
        try {
            client = MongoClients.create(uri);
            database = client.getDatabase(databaseName);
            log.info("Connected to MongoDB - database: {}", databaseName);
        } catch (MongoException | IllegalArgumentException e) {
            log.error("Failed to connect to MongoDB - database: {}", databaseName, e);
            client = null;
            database = null;
        }
    }

    @Override
    public synchronized void close() {
        if (client != null) {
            client.close();
            log.info("Closed MongoDB connection - database: {}", databaseName);
        }
        client = null;
        database = null;
    }

    @Override
    protected boolean upsert(String collection, String keyField, String key, Document document) {
        MongoCollection<Document> target = collection(collection);
        if (target == null) {
            return false;
        }
        UpdateResult result = target.replaceOne(Filters.eq(keyField, key), document, new ReplaceOptions().upsert(true));
        return result.wasAcknowledged() && (result.getMatchedCount() > 0 || result.getUpsertedId() != null);
    }

    @Override
    protected Document find(String collection, String keyField, String key) {
        MongoCollection<Document> target = collection(collection);
        return target == null ? null : target.find(Filters.eq(keyField, key)).first();
    }

    @Override
    protected long count(String collection) {
        MongoCollection<Document> target = collection(collection);
        return target == null ? 0 : target.countDocuments();
    }

    private synchronized MongoCollection<Document> collection(String logicalName) {
        if (database == null) {
            log.warn("No database connection - collection: {}", logicalName);
            return null;
        }
        return database.getCollection(collectionNames.getOrDefault(logicalName, logicalName));
    }
}
