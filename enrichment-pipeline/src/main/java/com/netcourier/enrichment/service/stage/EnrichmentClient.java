package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;

public interface EnrichmentClient {

    StageResponse<String> generate(PipelineStage stage, EnrichmentPrompt prompt, String renderedPrompt, String text, Deadline deadline);
}
