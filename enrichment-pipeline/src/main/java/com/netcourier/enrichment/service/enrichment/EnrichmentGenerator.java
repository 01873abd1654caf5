package com.netcourier.enrichment.service.enrichment;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.prompt.PromptRegistry;
import com.netcourier.enrichment.service.recovery.JsonRecoveryUnit;
import com.netcourier.enrichment.service.recovery.RecoveryResult;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.EnrichmentClient;
import com.netcourier.enrichment.service.stage.StageResponse;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class EnrichmentGenerator {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentGenerator.class);

    private final EnrichmentClient enrichmentClient;
    private final PromptRegistry promptRegistry;
    private final JsonRecoveryUnit recoveryUnit;
    private final MeterRegistry meterRegistry;
    private final int regenerationAttempts;

    public EnrichmentGenerator(EnrichmentClient enrichmentClient,
                               PromptRegistry promptRegistry,
                               JsonRecoveryUnit recoveryUnit,
                               PipelineProperties properties,
                               MeterRegistry meterRegistry) {
        this.enrichmentClient = enrichmentClient;
        this.promptRegistry = promptRegistry;
        this.recoveryUnit = recoveryUnit;
        this.meterRegistry = meterRegistry;
        this.regenerationAttempts = properties.getEnrichment().getRegenerationAttempts();
    }

    public GenerationOutcome generate(PipelineStage stage,
                                      EnrichmentPrompt prompt,
                                      String text,
                                      String language,
                                      Deadline deadline) {
        String rendered = promptRegistry.render(prompt, text, language);
        RecoveryResult last = null;
        for (int generation = 0; generation <= regenerationAttempts; generation++) {
            if (deadline.isExpired()) {
                return GenerationOutcome.failed(prompt, ErrorCode.DEADLINE_EXCEEDED, "document deadline expired before " + prompt.id());
            }
            StageResponse<String> response;
            try {
                response = enrichmentClient.generate(stage, prompt, rendered, text, deadline);
            } catch (PipelineException ex) {
                return GenerationOutcome.failed(prompt, ex.code(), ex.getMessage());
            }
            last = recoveryUnit.recover(response.body(), promptRegistry.schema(prompt));
            record(last);
            if (last instanceof RecoveryResult.Valid valid) {
                return GenerationOutcome.valid(prompt, valid.value());
            }
            log.warn("Output of prompt {} was {} (generation {} of {})",
                    prompt.id(), last.describe(), generation + 1, regenerationAttempts + 1);
        }
        return GenerationOutcome.failed(prompt, last.errorCode(), prompt.id() + " output " + last.describe());
    }

    private void record(RecoveryResult result) {
        String tag = result.isValid() ? "valid" : result.errorCode().name().toLowerCase(Locale.ROOT);
        meterRegistry.counter("pipeline.recovery", "result", tag).increment();
    }
}
