package io.github.yok.deploykit.db;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Bounded exponential backoff used when connecting.
 *
 * <p>
 * {@code maxAttempts} counts every connect attempt including the first one. The delay before
 * attempt {@code n} (n &ge; 2) is {@code initialDelay * multiplier^(n-2)}, capped at
 * {@code maxDelay} when set, and varied by up to &plusmn;10% when jitter is enabled.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    // null disables the cap
    private final Duration maxDelay;
    private final boolean jitter;

    /**
     * Creates a policy.
     *
     * @param maxAttempts total connect attempts, at least 1
     * @param initialDelay delay before the second attempt, must not be negative
     * @param multiplier growth factor, at least 1.0
     * @param maxDelay delay cap; {@code null} or zero disables it
     * @param jitter whether to vary each delay by up to &plusmn;10%
     * @throws IllegalArgumentException on invalid values
     */
    public RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier,
            Duration maxDelay, boolean jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay =
                (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay
                        : null;
        this.jitter = jitter;
    }

    /**
     * Returns the default policy: 3 attempts, 1s initial delay doubling up to 30s, with jitter.
     *
     * @return default policy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER,
                DEFAULT_MAX_DELAY, true);
    }

    /**
     * Returns a policy that makes exactly one attempt.
     *
     * @return single-attempt policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, null, false);
    }

    /**
     * Computes the delay to wait before the given attempt.
     *
     * @param attempt 1-based attempt number
     * @return delay; zero for the first attempt
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double raw = initialDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        long delayMillis = raw >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) raw;
        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }
        if (jitter && delayMillis > 0) {
            long spread = (long) (delayMillis * 0.1
                    * (ThreadLocalRandom.current().nextDouble() * 2 - 1));
            delayMillis = Math.max(0, delayMillis + spread);
        }
        return Duration.ofMillis(delayMillis);
    }
}
