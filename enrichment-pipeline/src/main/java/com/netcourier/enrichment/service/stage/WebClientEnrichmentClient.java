package com.netcourier.enrichment.service.stage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class WebClientEnrichmentClient implements EnrichmentClient {

    private final StageClient stageClient;
    private final PipelineProperties properties;

    public WebClientEnrichmentClient(WebClient enrichmentWebClient,
                                     PipelineProperties properties,
                                     MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(enrichmentWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.properties = properties;
    }

    @Override
    public StageResponse<String> generate(PipelineStage stage,
                                          EnrichmentPrompt prompt,
                                          String renderedPrompt,
                                          String text,
                                          Deadline deadline) {
        PipelineProperties.Endpoint config = properties.getStages().getEnrichment();
        StageResponse<EnrichResponse> response = stageClient.call(StageEndpoint.post(stage, config.getPath()),
                new EnrichRequest(text, prompt.id(), renderedPrompt), EnrichResponse.class, config.getTimeout(), deadline);
        EnrichResponse body = response.body();
        return new StageResponse<>(body == null ? null : body.rawOutput(), response.attempts());
    }

    private record EnrichRequest(String text, @JsonProperty("prompt_id") String promptId, String prompt) {}

    private record EnrichResponse(@JsonProperty("raw_output") String rawOutput) {}
}
