package com.tresComas.financialData.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store holding the same documents the Mongo store would write.
 * Used for local runs without a database and in tests.
 */
@Slf4j
public class InMemoryFinancialDataStore extends AbstractFinancialDataStore {

    private final Map<String, Map<String, Document>> collections = new ConcurrentHashMap<>();

    public InMemoryFinancialDataStore(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public void open() {
        log.info("Using in-memory financial data store");
    }

    @Override
    public void close() {
        collections.clear();
    }

    @Override
    protected boolean upsert(String collection, String keyField, String key, Document document) {
        collections.computeIfAbsent(collection, name -> new ConcurrentHashMap<>()).put(key, document);
        return true;
    }

    @Override
    protected Document find(String collection, String keyField, String key) {
        if (key == null) {
            return null;
        }
        return collections.getOrDefault(collection, Map.of()).get(key);
    }

    @Override
    protected long count(String collection) {
        return collections.getOrDefault(collection, Map.of()).size();
    }
}
