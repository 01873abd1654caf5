package com.netcourier.enrichment.service.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.RetryPolicy;
import com.netcourier.enrichment.service.stage.StageClient;
import com.netcourier.enrichment.service.stage.StageEndpoint;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Collections;
import java.util.List;

@Component
public class QdrantChunkRetriever {

    private final StageClient stageClient;
    private final PipelineProperties properties;
    private final int topK;

    public QdrantChunkRetriever(WebClient qdrantWebClient,
                                PipelineProperties properties,
                                MeterRegistry meterRegistry,
                                @Value("${chat.rag.top-k:5}") int topK) {
        this.stageClient = new StageClient(qdrantWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.properties = properties;
        this.topK = topK;
    }

    public List<RetrievedChunk> search(List<Double> vector, Deadline deadline) {
        PipelineProperties.Endpoint config = properties.getStages().getVectorStore();
        StageEndpoint endpoint = StageEndpoint.post(PipelineStage.STORAGE,
                config.getPath() + "/" + properties.getCollection() + "/points/search");
        SearchResponse response = stageClient.call(endpoint, new SearchRequest(vector, topK, true), SearchResponse.class,
                config.getTimeout(), deadline).body();
        if (response == null || response.result() == null) {
            return Collections.emptyList();
        }
        return response.result().stream().map(Result::toChunk).toList();
    }

    private record SearchRequest(List<Double> vector, int limit, @JsonProperty("with_payload") boolean withPayload) {}

    private record SearchResponse(List<Result> result) {}

    private record Result(double score, Payload payload) {
        RetrievedChunk toChunk() {
            if (payload == null) {
                return new RetrievedChunk("", "", "", "", "", score);
            }
            return new RetrievedChunk(payload.chunkId(), payload.documentId(), payload.source(), payload.text(), payload.summary(), score);
        }
    }

    private record Payload(@JsonProperty("chunk_id") String chunkId,
                           @JsonProperty("document_id") String documentId,
                           String source,
                           String text,
                           String summary) {}
}
