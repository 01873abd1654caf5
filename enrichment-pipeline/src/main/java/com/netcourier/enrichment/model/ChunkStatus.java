package com.netcourier.enrichment.model;

public enum ChunkStatus {
    RECONCILED,
    STORED,
    PARTIAL_FAILED,
    MERGED
}
