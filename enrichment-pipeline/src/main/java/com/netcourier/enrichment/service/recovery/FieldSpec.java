package com.netcourier.enrichment.service.recovery;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record FieldSpec(String name, FieldType type, int min, int max, Set<String> allowedValues) {

    public FieldSpec {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, FieldType.STRING, 1, 0, Set.of());
    }

    public static FieldSpec text(String name, int maxSentences) {
        return new FieldSpec(name, FieldType.STRING, 1, maxSentences, Set.of());
    }

    public static FieldSpec oneOf(String name, String... values) {
        Set<String> allowed = Arrays.stream(values)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return new FieldSpec(name, FieldType.STRING, 1, 0, allowed);
    }

    public static FieldSpec list(String name, int min, int max) {
        return new FieldSpec(name, FieldType.STRING_ARRAY, min, max, Set.of());
    }

    public static FieldSpec set(String name, int min, int max) {
        return new FieldSpec(name, FieldType.STRING_SET, min, max, Set.of());
    }

    public static FieldSpec entities(String name) {
        return new FieldSpec(name, FieldType.ENTITY_ARRAY, 0, Integer.MAX_VALUE, Set.of());
    }
}
