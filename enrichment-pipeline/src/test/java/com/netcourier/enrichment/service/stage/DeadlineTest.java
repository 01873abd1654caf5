package com.netcourier.enrichment.service.stage;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineTest {

    @Test
    void capsTimeoutToRemainingTime() {
        Deadline deadline = Deadline.after(Duration.ofHours(1));

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.cap(Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(5));
        assertThat(deadline.cap(Duration.ofHours(2))).isLessThanOrEqualTo(Duration.ofHours(1));
    }

    @Test
    void expiredDeadlineLeavesNoTime() {
        Deadline deadline = Deadline.after(Duration.ZERO);

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThat(deadline.cap(Duration.ofSeconds(5))).isEqualTo(Duration.ZERO);
    }
}
