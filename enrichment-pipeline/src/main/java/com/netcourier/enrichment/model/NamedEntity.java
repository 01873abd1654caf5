package com.netcourier.enrichment.model;

public record NamedEntity(String name, String type) {
}
