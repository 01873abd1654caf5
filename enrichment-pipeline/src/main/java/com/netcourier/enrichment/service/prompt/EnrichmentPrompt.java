package com.netcourier.enrichment.service.prompt;

import com.netcourier.enrichment.service.recovery.FieldSpec;
import com.netcourier.enrichment.service.recovery.OutputSchema;

public enum EnrichmentPrompt {

    SEMANTIC_CHUNKING("semantic-chunking",
            OutputSchema.wrappingArray("semantic_chunking", FieldSpec.list("chunks", 1, Integer.MAX_VALUE))),

    SUMMARY_KEYWORDS("summary-keywords",
            OutputSchema.of("summary_keywords", FieldSpec.text("summary", 3), FieldSpec.set("keywords", 3, 5))),

    QUESTIONS("questions",
            OutputSchema.wrappingArray("questions", FieldSpec.list("questions", 2, 3))),

    KEY_SENTENCES("key-sentences",
            OutputSchema.wrappingArray("key_sentences", FieldSpec.list("key_sentences", 1, 3))),

    METADATA("metadata",
            OutputSchema.of("metadata",
                    FieldSpec.text("main_topic"),
                    FieldSpec.oneOf("sentiment", "positive", "negative", "neutral", "mixed"),
                    FieldSpec.entities("entities")));

    private final String id;
    private final OutputSchema schema;

    EnrichmentPrompt(String id, OutputSchema schema) {
        this.id = id;
        this.schema = schema;
    }

    public String id() {
        return id;
    }

    public OutputSchema schema() {
        return schema;
    }

    public boolean isPerChunk() {
        return this != SEMANTIC_CHUNKING;
    }
}
