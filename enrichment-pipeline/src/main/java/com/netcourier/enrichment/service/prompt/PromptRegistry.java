package com.netcourier.enrichment.service.prompt;

import com.netcourier.enrichment.service.recovery.OutputSchema;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Component
public class PromptRegistry {

    private final Map<EnrichmentPrompt, String> templates;

    public PromptRegistry(PromptProperties properties) {
        Map<EnrichmentPrompt, String> loaded = new EnumMap<>(EnrichmentPrompt.class);
        loaded.put(EnrichmentPrompt.SEMANTIC_CHUNKING, properties.getSemanticChunking());
        loaded.put(EnrichmentPrompt.SUMMARY_KEYWORDS, properties.getSummaryKeywords());
        loaded.put(EnrichmentPrompt.QUESTIONS, properties.getQuestions());
        loaded.put(EnrichmentPrompt.KEY_SENTENCES, properties.getKeySentences());
        loaded.put(EnrichmentPrompt.METADATA, properties.getMetadata());
        loaded.forEach((prompt, template) -> {
            if (template == null || !template.contains("{text}")) {
                throw new IllegalStateException("Prompt template " + prompt.id() + " must contain a {text} placeholder");
            }
        });
        this.templates = Collections.unmodifiableMap(loaded);
    }

    public String render(EnrichmentPrompt prompt, String text, String language) {
        return templates.get(prompt)
                .replace("{language}", language == null ? "" : language)
                .replace("{text}", text);
    }

    public OutputSchema schema(EnrichmentPrompt prompt) {
        return prompt.schema();
    }
}
