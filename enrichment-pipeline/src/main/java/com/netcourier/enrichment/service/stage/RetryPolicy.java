package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy from(PipelineProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public Attempts start() {
        return new Attempts(this);
    }

    public static final class Attempts {

        private final RetryPolicy policy;
        private int attempt = 1;
        private Duration nextDelay;

        private Attempts(RetryPolicy policy) {
            this.policy = policy;
            this.nextDelay = policy.initialBackoff();
        }

        public int current() {
            return attempt;
        }

        public boolean canRetry() {
            return attempt < policy.maxAttempts();
        }

        public Duration advance() {
            if (!canRetry()) {
                throw new IllegalStateException("retry budget exhausted after " + attempt + " attempts");
            }
            Duration delay = nextDelay;
            attempt++;
            long grown = (long) (nextDelay.toMillis() * policy.multiplier());
            nextDelay = Duration.ofMillis(Math.min(grown, policy.maxBackoff().toMillis()));
            return delay;
        }
    }
}
