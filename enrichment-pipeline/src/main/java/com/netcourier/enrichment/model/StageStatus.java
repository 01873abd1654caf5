package com.netcourier.enrichment.model;

public enum StageStatus {
    PENDING,
    SUCCEEDED,
    RETRIED,
    FAILED
}
