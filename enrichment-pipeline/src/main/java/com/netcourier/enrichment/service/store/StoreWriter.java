package com.netcourier.enrichment.service.store;

import com.netcourier.enrichment.model.EmbeddingRecord;
import com.netcourier.enrichment.service.stage.Deadline;

import java.util.List;
import java.util.Map;

public interface StoreWriter {

    void ensureCollection(String collection, int vectorSize, Deadline deadline);

    void upsert(String collection, String chunkId, List<Double> vector, Map<String, Object> payload, Deadline deadline);

    default void upsert(EmbeddingRecord record, Deadline deadline) {
        upsert(record.collection(), record.chunk().id(), record.vector(), record.payload(), deadline);
    }

    void deleteCollection(String collection);
}
