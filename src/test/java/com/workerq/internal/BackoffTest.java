package com.workerq.internal;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffTest {

    @Test
    void shouldDoubleDelayPerAttempt() {
        Duration base = Duration.ofMillis(50);

        assertThat(Backoff.exponential(base, 0, null)).isEqualTo(Duration.ofMillis(50));
        assertThat(Backoff.exponential(base, 1, null)).isEqualTo(Duration.ofMillis(100));
        assertThat(Backoff.exponential(base, 4, null)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    void shouldCapDelay() {
        Duration cap = Duration.ofSeconds(5);

        assertThat(Backoff.exponential(Duration.ofSeconds(1), 2, cap)).isEqualTo(Duration.ofSeconds(4));
        assertThat(Backoff.exponential(Duration.ofSeconds(1), 3, cap)).isEqualTo(cap);
        assertThat(Backoff.exponential(Duration.ofSeconds(1), 1_000, cap)).isEqualTo(cap);
    }

    @Test
    void shouldNotOverflowForHugeBases() {
        Duration delay = Backoff.exponential(Duration.ofMillis(Long.MAX_VALUE / 2), 20, null);

        assertThat(delay).isEqualTo(Duration.ofMillis(Long.MAX_VALUE));
    }

    @Test
    void shouldTreatNegativeAttemptAsFirst() {
        assertThat(Backoff.exponential(Duration.ofMillis(10), -3, null)).isEqualTo(Duration.ofMillis(10));
    }

    @Test
    void shouldAddJitterProportionalToDelay() {
        Duration base = Duration.ofMillis(100);

        assertThat(Backoff.exponentialWithJitter(base, 1, 0.5, 0.0)).isEqualTo(Duration.ofMillis(200));
        assertThat(Backoff.exponentialWithJitter(base, 1, 0.5, 1.0)).isEqualTo(Duration.ofMillis(300));
        assertThat(Backoff.exponentialWithJitter(base, 1, 0.0, 1.0)).isEqualTo(Duration.ofMillis(200));
        assertThat(Backoff.exponentialWithJitter(base, 2, 0.5))
                .isBetween(Duration.ofMillis(400), Duration.ofMillis(600));
    }
}
