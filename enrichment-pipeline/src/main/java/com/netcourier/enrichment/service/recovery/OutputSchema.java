package com.netcourier.enrichment.service.recovery;

import java.util.List;

public record OutputSchema(String name, List<FieldSpec> fields, String rootArrayField) {

    public OutputSchema {
        fields = List.copyOf(fields);
    }

    public static OutputSchema of(String name, FieldSpec... fields) {
        return new OutputSchema(name, List.of(fields), null);
    }

    public static OutputSchema wrappingArray(String name, FieldSpec field) {
        return new OutputSchema(name, List.of(field), field.name());
    }
}
