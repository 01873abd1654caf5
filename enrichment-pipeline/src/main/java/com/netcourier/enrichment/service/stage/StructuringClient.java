package com.netcourier.enrichment.service.stage;

public interface StructuringClient {

    StageResponse<StructuredText> structure(String fileName, byte[] pdf, Deadline deadline);
}
