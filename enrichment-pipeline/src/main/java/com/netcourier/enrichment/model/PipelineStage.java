package com.netcourier.enrichment.model;

public enum PipelineStage {
    LANGUAGE_DETECTION,
    STRUCTURING,
    ANNOTATION,
    CHUNKING,
    ENRICHMENT,
    EMBEDDING,
    STORAGE;

    public boolean isPreChunking() {
        return ordinal() <= CHUNKING.ordinal();
    }
}
