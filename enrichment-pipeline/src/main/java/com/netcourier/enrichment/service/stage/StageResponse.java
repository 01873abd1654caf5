package com.netcourier.enrichment.service.stage;

import java.util.function.Function;

public record StageResponse<T>(T body, int attempts) {

    public static <T> StageResponse<T> of(T body) {
        return new StageResponse<>(body, 1);
    }

    public <R> StageResponse<R> map(Function<T, R> mapper) {
        return new StageResponse<>(mapper.apply(body), attempts);
    }
}
