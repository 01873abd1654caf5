package com.netcourier.enrichment.service.stage;

import java.util.List;

public interface EmbeddingClient {

    StageResponse<EmbeddingBatch> embedPassages(List<String> texts, Deadline deadline);

    StageResponse<List<Double>> embedQuery(String question, Deadline deadline);

    record EmbeddingBatch(List<List<Double>> vectors, String model, int dimensions) {}
}
