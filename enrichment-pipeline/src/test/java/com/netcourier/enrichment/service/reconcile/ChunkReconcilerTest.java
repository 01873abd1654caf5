package com.netcourier.enrichment.service.reconcile;

import com.netcourier.enrichment.model.Chunk;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.ChunkStatus;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.NamedEntity;
import com.netcourier.enrichment.service.enrichment.GenerationOutcome;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.recovery.ValidatedObject;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkReconcilerTest {

    private final ChunkReconciler reconciler = new ChunkReconciler();

    @Test
    void buildsBundleFromAllFourResults() {
        ChunkOutcome outcome = reconciler.reconcile("Payment is due within 30 days.", 1, "doc-1", "en",
                results(List.of("payment", "due date", "invoice")));

        assertThat(outcome.status()).isEqualTo(ChunkStatus.RECONCILED);
        assertThat(outcome.bundle().summary()).isEqualTo("Summary.");
        assertThat(outcome.bundle().keywords()).containsExactly("payment", "due date", "invoice");
        assertThat(outcome.bundle().questions()).containsExactly("When is payment due?", "What is due?");
        assertThat(outcome.bundle().keySentences()).containsExactly("Payment is due within 30 days.");
        assertThat(outcome.bundle().metadata().sentiment()).isEqualTo("neutral");
        assertThat(outcome.bundle().metadata().entities()).containsExactly(new NamedEntity("ACME", "ORG"));
    }

    @Test
    void reconcilingTheSameTextTwiceYieldsTheSameChunkId() {
        ChunkOutcome first = reconciler.reconcile("Payment is due.", 3, "doc-1", "en", results(List.of("a", "b", "c")));
        ChunkOutcome second = reconciler.reconcile("Payment is due.", 3, "doc-1", "en", results(List.of("a", "b", "c")));

        assertThat(first.chunkId()).isEqualTo(second.chunkId());
    }

    @Test
    void reportsFailedPartAsIncomplete() {
        Map<EnrichmentPrompt, GenerationOutcome> results = results(List.of("a", "b", "c"));
        results.put(EnrichmentPrompt.QUESTIONS, GenerationOutcome.failed(EnrichmentPrompt.QUESTIONS,
                ErrorCode.RECOVERY_UNPARSEABLE, "no JSON"));
        results.remove(EnrichmentPrompt.METADATA);

        ChunkOutcome outcome = reconciler.reconcile("Text.", 1, "doc-1", "en", results);

        assertThat(outcome.status()).isEqualTo(ChunkStatus.PARTIAL_FAILED);
        assertThat(outcome.errorCode()).isEqualTo(ErrorCode.RECONCILE_INCOMPLETE);
        assertThat(outcome.bundle()).isNull();
        assertThat(outcome.reason())
                .contains("questions: RECOVERY_UNPARSEABLE")
                .contains("metadata: no result");
    }

    @Test
    void rejectsBlankChunkText() {
        assertThatThrownBy(() -> reconciler.createChunk("doc-1", 1, "  ", "en"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void collapsesDuplicatesIntoLowestOrder() {
        Chunk first = reconciler.createChunk("doc-1", 1, "Same paragraph.", "en");
        Chunk other = reconciler.createChunk("doc-1", 2, "Different paragraph.", "en");
        Chunk duplicate = reconciler.createChunk("doc-1", 3, "same   PARAGRAPH.", "en");
        List<ChunkOutcome> outcomes = List.of(
                reconciler.reconcile(duplicate, results(List.of("gamma", "Alpha", "delta"))),
                reconciler.reconcile(first, results(List.of("alpha", "beta", "gamma"))),
                reconciler.reconcile(other, results(List.of("x", "y", "z"))));

        List<ChunkOutcome> collapsed = reconciler.collapseDuplicates(outcomes);

        assertThat(collapsed).extracting(ChunkOutcome::order).containsExactly(1, 2, 3);
        assertThat(collapsed.get(0).status()).isEqualTo(ChunkStatus.RECONCILED);
        assertThat(collapsed.get(0).bundle().keywords()).containsExactly("alpha", "beta", "gamma", "delta");
        assertThat(collapsed.get(1).bundle().keywords()).containsExactly("x", "y", "z");
        assertThat(collapsed.get(2).status()).isEqualTo(ChunkStatus.MERGED);
        assertThat(collapsed.get(2).mergedInto()).isEqualTo(first.id());
    }

    @Test
    void survivorTakesBundleOfCompleteDuplicate() {
        Chunk first = reconciler.createChunk("doc-1", 1, "Repeated.", "en");
        Chunk duplicate = reconciler.createChunk("doc-1", 2, "Repeated.", "en");
        List<ChunkOutcome> outcomes = List.of(
                ChunkOutcome.partialFailed(first, ErrorCode.STAGE_TIMEOUT, "timed out"),
                reconciler.reconcile(duplicate, results(List.of("a", "b", "c"))));

        List<ChunkOutcome> collapsed = reconciler.collapseDuplicates(outcomes);

        assertThat(collapsed.get(0).chunkId()).isEqualTo(first.id());
        assertThat(collapsed.get(0).status()).isEqualTo(ChunkStatus.RECONCILED);
        assertThat(collapsed.get(0).bundle().keywords()).containsExactly("a", "b", "c");
        assertThat(collapsed.get(1).status()).isEqualTo(ChunkStatus.MERGED);
    }

    @Test
    void groupWithoutCompleteBundleKeepsSurvivorFailure() {
        Chunk first = reconciler.createChunk("doc-1", 1, "Repeated.", "en");
        Chunk duplicate = reconciler.createChunk("doc-1", 2, "Repeated.", "en");

        List<ChunkOutcome> collapsed = reconciler.collapseDuplicates(List.of(
                ChunkOutcome.partialFailed(first, ErrorCode.STAGE_TIMEOUT, "timed out"),
                ChunkOutcome.partialFailed(duplicate, ErrorCode.RECONCILE_INCOMPLETE, "incomplete")));

        assertThat(collapsed.get(0).status()).isEqualTo(ChunkStatus.PARTIAL_FAILED);
        assertThat(collapsed.get(0).errorCode()).isEqualTo(ErrorCode.STAGE_TIMEOUT);
        assertThat(collapsed.get(1).status()).isEqualTo(ChunkStatus.MERGED);
    }

    private Map<EnrichmentPrompt, GenerationOutcome> results(List<String> keywords) {
        Map<EnrichmentPrompt, GenerationOutcome> results = new EnumMap<>(EnrichmentPrompt.class);
        results.put(EnrichmentPrompt.SUMMARY_KEYWORDS, GenerationOutcome.valid(EnrichmentPrompt.SUMMARY_KEYWORDS,
                new ValidatedObject("summary_keywords", Map.of("summary", "Summary.", "keywords", keywords))));
        results.put(EnrichmentPrompt.QUESTIONS, GenerationOutcome.valid(EnrichmentPrompt.QUESTIONS,
                new ValidatedObject("questions", Map.of("questions", List.of("When is payment due?", "What is due?")))));
        results.put(EnrichmentPrompt.KEY_SENTENCES, GenerationOutcome.valid(EnrichmentPrompt.KEY_SENTENCES,
                new ValidatedObject("key_sentences", Map.of("key_sentences", List.of("Payment is due within 30 days.")))));
        results.put(EnrichmentPrompt.METADATA, GenerationOutcome.valid(EnrichmentPrompt.METADATA,
                new ValidatedObject("metadata", Map.of(
                        "main_topic", "Payment terms",
                        "sentiment", "neutral",
                        "entities", List.of(Map.of("name", "ACME", "type", "ORG"))))));
        return results;
    }
}
