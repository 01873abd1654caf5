package com.netcourier.enrichment.model;

public enum PipelineState {
    INGESTED,
    LANGUAGE_DETECTED,
    STRUCTURED,
    ANNOTATED,
    CHUNKED,
    ENRICHING,
    EMBEDDED,
    STORED,
    FAILED;

    public boolean isTerminal() {
        return this == STORED || this == FAILED;
    }
}
