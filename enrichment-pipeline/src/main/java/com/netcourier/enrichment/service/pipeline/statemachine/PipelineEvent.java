package com.netcourier.enrichment.service.pipeline.statemachine;

public enum PipelineEvent {
    ADVANCE,
    FAIL
}
