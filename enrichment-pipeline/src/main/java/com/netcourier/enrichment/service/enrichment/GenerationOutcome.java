package com.netcourier.enrichment.service.enrichment;

import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.recovery.ValidatedObject;

public record GenerationOutcome(EnrichmentPrompt prompt, ValidatedObject value, ErrorCode errorCode, String reason) {

    public static GenerationOutcome valid(EnrichmentPrompt prompt, ValidatedObject value) {
        return new GenerationOutcome(prompt, value, null, null);
    }

    public static GenerationOutcome failed(EnrichmentPrompt prompt, ErrorCode errorCode, String reason) {
        return new GenerationOutcome(prompt, null, errorCode, reason);
    }

    public boolean succeeded() {
        return value != null;
    }
}
