package com.netcourier.enrichment.model;

import java.util.List;

public record Annotation(List<AnnotatedEntity> entities, List<Lemma> lemmas, String processedLanguage) {

    public Annotation {
        entities = entities == null ? List.of() : List.copyOf(entities);
        lemmas = lemmas == null ? List.of() : List.copyOf(lemmas);
    }

    public record AnnotatedEntity(String text, String label) {
    }

    public record Lemma(String token, String lemma) {
    }
}
