package com.netcourier.enrichment.service.enrichment;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.prompt.PromptProperties;
import com.netcourier.enrichment.service.prompt.PromptRegistry;
import com.netcourier.enrichment.service.recovery.JsonRecoveryUnit;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.EnrichmentClient;
import com.netcourier.enrichment.service.stage.StageException;
import com.netcourier.enrichment.service.stage.StageResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentGeneratorTest {

    @Mock
    private EnrichmentClient enrichmentClient;

    private SimpleMeterRegistry meterRegistry;
    private EnrichmentGenerator generator;

    @BeforeEach
    void setUp() {
        PromptProperties prompts = new PromptProperties();
        prompts.setSemanticChunking("Split: {text}");
        prompts.setSummaryKeywords("Summarize: {text}");
        prompts.setQuestions("Ask ({language}): {text}");
        prompts.setKeySentences("Pick: {text}");
        prompts.setMetadata("Describe: {text}");
        PipelineProperties properties = new PipelineProperties();
        properties.getEnrichment().setRegenerationAttempts(1);
        meterRegistry = new SimpleMeterRegistry();
        generator = new EnrichmentGenerator(enrichmentClient, new PromptRegistry(prompts), new JsonRecoveryUnit(),
                properties, meterRegistry);
    }

    @Test
    void regeneratesWhenOutputCannotBeRecovered() {
        when(enrichmentClient.generate(eq(PipelineStage.ENRICHMENT), eq(EnrichmentPrompt.QUESTIONS), eq("Ask (en): Fees apply."),
                eq("Fees apply."), any(Deadline.class)))
                .thenReturn(StageResponse.of("I am not sure."))
                .thenReturn(StageResponse.of("[\"Which fees apply?\", \"When do fees apply?\"]"));

        GenerationOutcome outcome = generator.generate(PipelineStage.ENRICHMENT, EnrichmentPrompt.QUESTIONS, "Fees apply.", "en",
                Deadline.after(Duration.ofMinutes(1)));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.value().strings("questions")).containsExactly("Which fees apply?", "When do fees apply?");
        assertThat(meterRegistry.counter("pipeline.recovery", "result", "recovery_unparseable").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("pipeline.recovery", "result", "valid").count()).isEqualTo(1.0);
    }

    @Test
    void reportsLastRecoveryErrorWhenAllGenerationsFail() {
        when(enrichmentClient.generate(eq(PipelineStage.ENRICHMENT), eq(EnrichmentPrompt.QUESTIONS), anyString(), anyString(), any(Deadline.class)))
                .thenReturn(StageResponse.of("[\"Only one?\"]"));

        GenerationOutcome outcome = generator.generate(PipelineStage.ENRICHMENT, EnrichmentPrompt.QUESTIONS, "Fees apply.", "en",
                Deadline.after(Duration.ofMinutes(1)));

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.errorCode()).isEqualTo(ErrorCode.RECOVERY_SCHEMA_MISMATCH);
        verify(enrichmentClient, times(2)).generate(eq(PipelineStage.ENRICHMENT), eq(EnrichmentPrompt.QUESTIONS), anyString(),
                anyString(), any(Deadline.class));
    }

    @Test
    void passesStageFailureThroughWithoutRegenerating() {
        when(enrichmentClient.generate(eq(PipelineStage.ENRICHMENT), eq(EnrichmentPrompt.METADATA), anyString(), anyString(), any(Deadline.class)))
                .thenThrow(new StageException(PipelineStage.ENRICHMENT, ErrorCode.STAGE_TIMEOUT, 3, "timed out"));

        GenerationOutcome outcome = generator.generate(PipelineStage.ENRICHMENT, EnrichmentPrompt.METADATA, "Fees apply.", "en",
                Deadline.after(Duration.ofMinutes(1)));

        assertThat(outcome.errorCode()).isEqualTo(ErrorCode.STAGE_TIMEOUT);
        verify(enrichmentClient, times(1)).generate(any(), any(), anyString(), anyString(), any(Deadline.class));
    }

    @Test
    void doesNotCallTheStageAfterTheDeadline() {
        GenerationOutcome outcome = generator.generate(PipelineStage.ENRICHMENT, EnrichmentPrompt.METADATA, "Fees apply.", "en",
                Deadline.after(Duration.ZERO));

        assertThat(outcome.errorCode()).isEqualTo(ErrorCode.DEADLINE_EXCEEDED);
        verifyNoInteractions(enrichmentClient);
    }
}
