package com.netcourier.enrichment.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record EnrichmentBundle(String summary,
                               Set<String> keywords,
                               List<String> questions,
                               List<String> keySentences,
                               ChunkMetadata metadata) {

    public EnrichmentBundle {
        keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords == null ? Set.of() : keywords));
        questions = questions == null ? List.of() : List.copyOf(questions);
        keySentences = keySentences == null ? List.of() : List.copyOf(keySentences);
    }

    public EnrichmentBundle mergedWith(EnrichmentBundle other) {
        if (other == null) {
            return this;
        }
        Set<String> mergedKeywords = new LinkedHashSet<>(keywords);
        for (String keyword : other.keywords()) {
            boolean present = mergedKeywords.stream().anyMatch(existing -> existing.equalsIgnoreCase(keyword));
            if (!present) {
                mergedKeywords.add(keyword);
            }
        }
        List<NamedEntity> entities = new ArrayList<>(metadata.entities());
        for (NamedEntity entity : other.metadata().entities()) {
            if (!entities.contains(entity)) {
                entities.add(entity);
            }
        }
        return new EnrichmentBundle(
                summary,
                mergedKeywords,
                distinctConcat(questions, other.questions()),
                distinctConcat(keySentences, other.keySentences()),
                new ChunkMetadata(metadata.mainTopic(), metadata.sentiment(), entities));
    }

    private static List<String> distinctConcat(List<String> first, List<String> second) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> merged = new ArrayList<>();
        for (String value : first) {
            if (seen.add(value.trim().toLowerCase(Locale.ROOT))) {
                merged.add(value);
            }
        }
        for (String value : second) {
            if (seen.add(value.trim().toLowerCase(Locale.ROOT))) {
                merged.add(value);
            }
        }
        return merged;
    }
}
