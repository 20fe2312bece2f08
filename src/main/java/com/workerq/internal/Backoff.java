package com.workerq.internal;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff arithmetic shared by the transaction retry loop and the worker
 * restart supervisor.
 */
public final class Backoff {

    // 2^20 * base is already far beyond any sensible delay
    private static final int MAX_EXPONENT = 20;

    private Backoff() {
    }

    /**
     * {@code base * 2^attempt}, optionally capped.
     */
    public static Duration exponential(Duration base, int attempt, Duration cap) {
        long multiplier = 1L << Math.min(Math.max(attempt, 0), MAX_EXPONENT);
        long millis;
        try {
            millis = Math.multiplyExact(base.toMillis(), multiplier);
        } catch (ArithmeticException overflow) {
            millis = Long.MAX_VALUE;
        }
        Duration delay = Duration.ofMillis(millis);
        return cap != null && delay.compareTo(cap) > 0 ? cap : delay;
    }

    /**
     * {@code base * 2^attempt} plus a random share of it, up to {@code jitterFactor}.
     */
    public static Duration exponentialWithJitter(Duration base, int attempt, double jitterFactor) {
        return exponentialWithJitter(base, attempt, jitterFactor, ThreadLocalRandom.current().nextDouble());
    }

    static Duration exponentialWithJitter(Duration base, int attempt, double jitterFactor, double random) {
        Duration delay = exponential(base, attempt, null);
        long jitter = (long) (delay.toMillis() * Math.max(jitterFactor, 0.0) * random);
        return delay.plusMillis(jitter);
    }
}
