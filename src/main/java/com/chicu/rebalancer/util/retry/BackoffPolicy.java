package com.chicu.rebalancer.util.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Random;

/**
 * Геометрический backoff с потолком и случайным джиттером.
 * Задержка после попытки n: min(base * multiplier^n, maxDelay) + uniform(0, jitter).
 */
@Value
public class BackoffPolicy {

    Duration baseDelay;
    double multiplier;
    Duration maxDelay;
    Duration jitter;
    int maxAttempts;

    @Builder
    public BackoffPolicy(Duration baseDelay, double multiplier, Duration maxDelay, Duration jitter, int maxAttempts) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitter = jitter == null ? Duration.ZERO : jitter;
        this.maxAttempts = maxAttempts;
    }

    /** Задержка без джиттера для попытки с номером {@code attempt} (с нуля). */
    public Duration baseDelayFor(int attempt) {
        double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public Duration delayFor(int attempt, Random random) {
        long jitterMs = jitter.toMillis() <= 0 ? 0 : (long) (random.nextDouble() * jitter.toMillis());
        return baseDelayFor(attempt).plusMillis(jitterMs);
    }

    /** Верхняя граница суммарного ожидания за {@code attempts} пауз. */
    public Duration maxTotalDelay(int attempts) {
        Duration total = Duration.ZERO;
        for (int i = 0; i < attempts; i++) {
            total = total.plus(baseDelayFor(i)).plus(jitter);
        }
        return total;
    }
}
