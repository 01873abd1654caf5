package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.PipelineStage;
import org.springframework.http.HttpMethod;

public record StageEndpoint(PipelineStage stage, HttpMethod method, String path) {

    public static StageEndpoint post(PipelineStage stage, String path) {
        return new StageEndpoint(stage, HttpMethod.POST, path);
    }
}
