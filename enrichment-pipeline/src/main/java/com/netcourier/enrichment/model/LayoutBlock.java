package com.netcourier.enrichment.model;

public record LayoutBlock(String type, String text, Integer page) {
}
