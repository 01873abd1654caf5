package com.netcourier.enrichment.service.recovery;

import com.netcourier.enrichment.model.ErrorCode;

public sealed interface RecoveryResult permits RecoveryResult.Valid, RecoveryResult.Unparseable, RecoveryResult.SchemaMismatch {

    record Valid(ValidatedObject value) implements RecoveryResult {
    }

    record Unparseable(String reason) implements RecoveryResult {
    }

    record SchemaMismatch(String reason) implements RecoveryResult {
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    default ErrorCode errorCode() {
        if (this instanceof Unparseable) {
            return ErrorCode.RECOVERY_UNPARSEABLE;
        }
        if (this instanceof SchemaMismatch) {
            return ErrorCode.RECOVERY_SCHEMA_MISMATCH;
        }
        return null;
    }

    default String describe() {
        if (this instanceof Unparseable unparseable) {
            return "unparseable: " + unparseable.reason();
        }
        if (this instanceof SchemaMismatch mismatch) {
            return "schema mismatch: " + mismatch.reason();
        }
        return "valid";
    }
}
