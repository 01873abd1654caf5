package com.netcourier.enrichment.model;

import java.util.List;
import java.util.Map;

public record EmbeddingRecord(String collection,
                              Chunk chunk,
                              List<Double> vector,
                              Map<String, Object> payload) {
}
