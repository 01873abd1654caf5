package com.netcourier.enrichment.service.stage;

public interface LanguageDetectionClient {

    StageResponse<String> detect(String text, Deadline deadline);
}
