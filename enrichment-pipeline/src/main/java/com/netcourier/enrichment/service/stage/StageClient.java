package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.ErrorCode;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Calls one remote stage with a bounded timeout and bounded retries.
 *
 * <p>Connection failures, timeouts and 5xx responses (plus 408 and 429) are retried with exponential
 * backoff; any other 4xx is surfaced at once as {@link ErrorCode#STAGE_REJECTED}. The client keeps no
 * state between calls.</p>
 */
public class StageClient {

    private static final Logger log = LoggerFactory.getLogger(StageClient.class);

    private final WebClient webClient;
    private final RetryPolicy retryPolicy;
    private final MeterRegistry meterRegistry;

    public StageClient(WebClient webClient, RetryPolicy retryPolicy, MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
    }

    public <T> StageResponse<T> call(StageEndpoint endpoint,
                                     Object payload,
                                     Class<T> responseType,
                                     Duration stageTimeout,
                                     Deadline deadline) {
        return call(endpoint, payload, ParameterizedTypeReference.forType(responseType), stageTimeout, deadline);
    }

    /**
     * Each attempt is bounded by {@code stageTimeout} and by what is left of {@code deadline};
     * backoff never sleeps past the deadline and no attempt starts once it has expired.
     */
    public <T> StageResponse<T> call(StageEndpoint endpoint,
                                     Object payload,
                                     ParameterizedTypeReference<T> responseType,
                                     Duration stageTimeout,
                                     Deadline deadline) {
        RetryPolicy.Attempts attempts = retryPolicy.start();
        String lastFailure = null;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(endpoint, attempts.current() - 1, null);
            }
            Duration timeout = deadline.cap(stageTimeout);
            if (timeout.isZero() || timeout.isNegative()) {
                throw deadlineExceeded(endpoint, attempts.current() - 1, lastFailure);
            }
            try {
                T body = invoke(endpoint, payload, responseType, timeout);
                return new StageResponse<>(body, attempts.current());
            } catch (RuntimeException ex) {
                Throwable cause = Exceptions.unwrap(ex);
                if (cause instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                    throw cancelled(endpoint, attempts.current(), cause);
                }
                Failure failure = classify(cause);
                if (!failure.retryable()) {
                    log.warn("Stage {} rejected the request: {}", endpoint.stage(), failure.message());
                    throw new StageException(endpoint.stage(), failure.code(), attempts.current(),
                            "Stage " + endpoint.stage() + " rejected the request: " + failure.message(), cause);
                }
                if (!attempts.canRetry()) {
                    log.error("Stage {} failed after {} attempts: {}", endpoint.stage(), attempts.current(), failure.message());
                    throw new StageException(endpoint.stage(), failure.code(), attempts.current(),
                            "Stage " + endpoint.stage() + " failed after " + attempts.current() + " attempts: " + failure.message(), cause);
                }
                if (deadline.isExpired()) {
                    throw deadlineExceeded(endpoint, attempts.current(), failure.message());
                }
                lastFailure = failure.message();
                Duration delay = deadline.cap(attempts.advance());
                log.warn("Stage {} attempt {} failed ({}), retrying in {} ms",
                        endpoint.stage(), attempts.current() - 1, failure.message(), delay.toMillis());
                if (meterRegistry != null) {
                    meterRegistry.counter("pipeline.stage.retries", "stage", endpoint.stage().name()).increment();
                }
                backoff(endpoint, attempts.current() - 1, delay);
            }
        }
    }

    private <T> T invoke(StageEndpoint endpoint, Object payload, ParameterizedTypeReference<T> responseType, Duration timeout) {
        WebClient.RequestBodySpec request = webClient.method(endpoint.method()).uri(endpoint.path());
        WebClient.RequestHeadersSpec<?> spec;
        if (payload == null) {
            spec = request;
        } else if (payload instanceof MultiValueMap<?, ?>) {
            spec = request.contentType(MediaType.MULTIPART_FORM_DATA).bodyValue(payload);
        } else {
            spec = request.contentType(MediaType.APPLICATION_JSON).bodyValue(payload);
        }
        return spec.retrieve()
                .bodyToMono(responseType)
                .timeout(timeout)
                .block();
    }

    private Failure classify(Throwable cause) {
        if (cause instanceof WebClientResponseException responseException) {
            HttpStatus status = HttpStatus.resolve(responseException.getStatusCode().value());
            String message = "HTTP " + responseException.getStatusCode().value();
            if (responseException.getStatusCode().is5xxServerError()
                    || status == HttpStatus.REQUEST_TIMEOUT
                    || status == HttpStatus.TOO_MANY_REQUESTS) {
                return new Failure(ErrorCode.STAGE_UNREACHABLE, true, message);
            }
            return new Failure(ErrorCode.STAGE_REJECTED, false, message);
        }
        if (cause instanceof TimeoutException) {
            return new Failure(ErrorCode.STAGE_TIMEOUT, true, "timed out");
        }
        if (cause instanceof WebClientRequestException requestException) {
            if (requestException.getCause() instanceof ReadTimeoutException) {
                return new Failure(ErrorCode.STAGE_TIMEOUT, true, "response timed out");
            }
            return new Failure(ErrorCode.STAGE_UNREACHABLE, true, String.valueOf(requestException.getMessage()));
        }
        return new Failure(ErrorCode.STAGE_UNREACHABLE, true, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private void backoff(StageEndpoint endpoint, int attemptsTaken, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(endpoint, attemptsTaken, e);
        }
    }

    private StageException deadlineExceeded(StageEndpoint endpoint, int attemptsTaken, String lastFailure) {
        String message = attemptsTaken == 0
                ? "No time left to call stage " + endpoint.stage()
                : "Deadline expired after " + attemptsTaken + " attempts at stage " + endpoint.stage() + ", last failure: " + lastFailure;
        log.warn(message);
        return new StageException(endpoint.stage(), ErrorCode.DEADLINE_EXCEEDED, attemptsTaken, message);
    }

    private StageException cancelled(StageEndpoint endpoint, int attemptsTaken, Throwable cause) {
        Thread.currentThread().interrupt();
        return new StageException(endpoint.stage(), ErrorCode.DEADLINE_EXCEEDED, attemptsTaken,
                "Call to stage " + endpoint.stage() + " was cancelled", cause);
    }

    private record Failure(ErrorCode code, boolean retryable, String message) {}
}
