package com.netcourier.enrichment.model;

public enum ErrorCode {
    STAGE_UNREACHABLE,
    STAGE_REJECTED,
    STAGE_TIMEOUT,
    RECOVERY_UNPARSEABLE,
    RECOVERY_SCHEMA_MISMATCH,
    RECONCILE_INCOMPLETE,
    DEADLINE_EXCEEDED,
    STORE_FAILED
}
