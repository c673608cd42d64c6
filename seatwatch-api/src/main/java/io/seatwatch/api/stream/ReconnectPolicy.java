package io.seatwatch.api.stream;

import java.time.Duration;

/**
 * Capped exponential backoff with a finite number of attempts.
 * <p>
 * Attempt {@code n} (1-based) waits {@code initialDelay * multiplier^n}, capped at {@code maxDelay}.
 * With the defaults that is 2s, 4s, 8s, 16s, then 30s until 10 attempts are used up.
 */
public final class ReconnectPolicy {

    private Duration initialDelay = Duration.ofSeconds(1);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofSeconds(30);
    private int maxAttempts = 10;

    private ReconnectPolicy() {}

    public static ReconnectPolicy create() {
        return new ReconnectPolicy();
    }

    public ReconnectPolicy initialDelay(Duration initialDelay) {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay must not be negative");
        }
        this.initialDelay = initialDelay;
        return this;
    }

    public ReconnectPolicy multiplier(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1");
        }
        this.multiplier = multiplier;
        return this;
    }

    public ReconnectPolicy maxDelay(Duration maxDelay) {
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("Max delay must not be negative");
        }
        this.maxDelay = maxDelay;
        return this;
    }

    public ReconnectPolicy maxAttempts(int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts must not be negative");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    public Duration initialDelay() { return initialDelay; }
    public double multiplier() { return multiplier; }
    public Duration maxDelay() { return maxDelay; }
    public int maxAttempts() { return maxAttempts; }

    /**
     * @return true while the attempt is within the ceiling
     */
    public boolean shouldRetry(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    /**
     * @param attempt 1-based reconnect attempt
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be 1 or greater");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
