package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.PipelineException;

public class StageException extends PipelineException {

    private final PipelineStage stage;
    private final int attempts;

    public StageException(PipelineStage stage, ErrorCode code, int attempts, String message) {
        super(code, message);
        this.stage = stage;
        this.attempts = attempts;
    }

    public StageException(PipelineStage stage, ErrorCode code, int attempts, String message, Throwable cause) {
        super(code, message, cause);
        this.stage = stage;
        this.attempts = attempts;
    }

    public PipelineStage stage() {
        return stage;
    }

    public int attempts() {
        return attempts;
    }
}
