package com.netcourier.enrichment.service.recovery;

public enum FieldType {
    STRING,
    STRING_ARRAY,
    STRING_SET,
    ENTITY_ARRAY
}
