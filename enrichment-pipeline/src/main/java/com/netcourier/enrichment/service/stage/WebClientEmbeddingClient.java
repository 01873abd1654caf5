package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

@Component
public class WebClientEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingClient.class);

    private final StageClient stageClient;
    private final StageEndpoint endpoint;
    private final PipelineProperties properties;

    public WebClientEmbeddingClient(WebClient embeddingWebClient,
                                    PipelineProperties properties,
                                    MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(embeddingWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.endpoint = StageEndpoint.post(PipelineStage.EMBEDDING, properties.getStages().getEmbedding().getPath());
        this.properties = properties;
    }

    @Override
    public StageResponse<EmbeddingBatch> embedPassages(List<String> texts, Deadline deadline) {
        String prefix = properties.getEmbedding().getPassagePrefix();
        return embed(texts.stream().map(text -> prefixed(prefix, text)).toList(), deadline);
    }

    @Override
    public StageResponse<List<Double>> embedQuery(String question, Deadline deadline) {
        StageResponse<EmbeddingBatch> batch = embed(List.of(prefixed(properties.getEmbedding().getQueryPrefix(), question)), deadline);
        return batch.map(result -> result.vectors().get(0));
    }

    private StageResponse<EmbeddingBatch> embed(List<String> texts, Deadline deadline) {
        if (texts == null || texts.isEmpty()) {
            throw new StageException(PipelineStage.EMBEDDING, ErrorCode.STAGE_REJECTED, 0, "No texts provided for embedding");
        }
        StageResponse<EmbedResponse> response = stageClient.call(endpoint, new EmbedRequest(texts), EmbedResponse.class,
                properties.getStages().getEmbedding().getTimeout(), deadline);
        EmbedResponse body = response.body();
        if (body == null || body.vectors() == null || body.vectors().size() != texts.size()) {
            int received = body == null || body.vectors() == null ? 0 : body.vectors().size();
            log.error("Embedding service returned {} vectors for {} texts", received, texts.size());
            throw new StageException(PipelineStage.EMBEDDING, ErrorCode.STAGE_REJECTED, response.attempts(),
                    "Embedding service returned " + received + " vectors for " + texts.size() + " texts");
        }
        return new StageResponse<>(new EmbeddingBatch(body.vectors(), body.model(), body.dimensions()), response.attempts());
    }

    private String prefixed(String prefix, String text) {
        return prefix == null || prefix.isEmpty() || text.startsWith(prefix) ? text : prefix + text;
    }

    private record EmbedRequest(List<String> texts) {}

    private record EmbedResponse(List<List<Double>> vectors, String model, int dimensions) {}
}
