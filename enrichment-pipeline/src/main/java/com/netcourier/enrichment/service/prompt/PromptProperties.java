package com.netcourier.enrichment.service.prompt;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pipeline.prompts")
public class PromptProperties {

    @NotBlank
    private String semanticChunking;

    @NotBlank
    private String summaryKeywords;

    @NotBlank
    private String questions;

    @NotBlank
    private String keySentences;

    @NotBlank
    private String metadata;

    public String getSemanticChunking() {
        return semanticChunking;
    }

    public void setSemanticChunking(String semanticChunking) {
        this.semanticChunking = semanticChunking;
    }

    public String getSummaryKeywords() {
        return summaryKeywords;
    }

    public void setSummaryKeywords(String summaryKeywords) {
        this.summaryKeywords = summaryKeywords;
    }

    public String getQuestions() {
        return questions;
    }

    public void setQuestions(String questions) {
        this.questions = questions;
    }

    public String getKeySentences() {
        return keySentences;
    }

    public void setKeySentences(String keySentences) {
        this.keySentences = keySentences;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }
}
