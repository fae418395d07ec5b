package in.oracore.infrastructure.provider;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff for provider calls.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .jitter(0.2)
 *     .maxAttempts(5)
 *     .build();
 *
 * while (true) {
 *     try {
 *         return fetch();
 *     } catch (ProviderException e) {
 *         Duration delay = policy.getNextDelay();
 *         policy.recordFailure();
 *         if (!policy.shouldRetry()) throw e;
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 *
 * With a jitter of {@code j}, each delay handed out is the nominal delay scaled by a uniform
 * factor in {@code [1 - j, 1]}, so streams that failed together do not retry in lockstep.
 * The nominal delay still grows and caps as without jitter.
 *
 * A policy tracks one call sequence; use {@link #fresh()} to start another with the same settings.
 */
public class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final double jitter;
    private final DoubleSupplier random;

    private int attemptCount = 0;
    private Duration currentDelay;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts,
                          double jitter, DoubleSupplier random) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
        this.random = random;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while fewer than {@code maxAttempts} attempts have failed
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt, with jitter applied.
     */
    public synchronized Duration getNextDelay() {
        if (jitter == 0.0) {
            return currentDelay;
        }
        double factor = 1.0 - jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(currentDelay.toMillis() * factor));
    }

    /**
     * Count a failed attempt and grow the delay, capped at {@code maxDelay}.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        long next = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * New policy with the same settings and no recorded attempts.
     */
    public BackoffPolicy fresh() {
        return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter, random);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for the market-data provider: 500 ms doubling up to 30 s with 20% jitter, five attempts.
     */
    public static BackoffPolicy forProvider() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .jitter(0.2)
            .maxAttempts(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 5;
        private double jitter = 0.0;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * @param jitter fraction in [0, 1] by which a delay may be shortened at random
         */
        public Builder jitter(double jitter) {
            if (jitter < 0.0 || jitter > 1.0) {
                throw new IllegalArgumentException("Jitter must be in [0, 1]");
            }
            this.jitter = jitter;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) for jitter.
         */
        Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public BackoffPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("Max delay must be >= initial delay");
            }
            return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts, jitter, random);
        }
    }
}
