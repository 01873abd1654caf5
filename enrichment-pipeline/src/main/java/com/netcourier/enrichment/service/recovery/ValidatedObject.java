package com.netcourier.enrichment.service.recovery;

import com.netcourier.enrichment.model.NamedEntity;

import java.util.List;
import java.util.Map;

public record ValidatedObject(String schema, Map<String, Object> fields) {

    public ValidatedObject {
        fields = Map.copyOf(fields);
    }

    public String string(String name) {
        return (String) fields.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<String> strings(String name) {
        return (List<String>) fields.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<NamedEntity> entities(String name) {
        List<Map<String, String>> raw = (List<Map<String, String>>) fields.get(name);
        return raw.stream().map(entry -> new NamedEntity(entry.get("name"), entry.get("type"))).toList();
    }
}
