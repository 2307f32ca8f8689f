package com.mailroute.gateway.retry;

import com.mailroute.gateway.config.GatewayConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes the wait between two attempts on the same provider.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   delay(retry) = min(retryDelay × factor^retry + jitter, maxDelay)
 *   jitter       = random(0, retryDelay × jitterRatio)
 * </pre>
 *
 * <p>{@code retryDelay} comes from the task's routing row. With the default
 * factor of 1 and no jitter the delay is exactly {@code retryDelay} every
 * time.
 */
public class RetryBackoff {

    private final double factor;
    private final long   maxDelayMs;
    private final double jitterRatio;

    public RetryBackoff(final GatewayConfig config) {
        this(config.getBackoffFactor(), config.getBackoffMaxDelayMs(), config.getBackoffJitterRatio());
    }

    public RetryBackoff(final double factor, final long maxDelayMs, final double jitterRatio) {
        if (factor < 1.0) {
            throw new IllegalArgumentException("Back-off factor must be >= 1: " + factor);
        }
        if (jitterRatio < 0.0) {
            throw new IllegalArgumentException("Jitter ratio must be >= 0: " + jitterRatio);
        }
        this.factor      = factor;
        this.maxDelayMs  = maxDelayMs;
        this.jitterRatio = jitterRatio;
    }

    /** Fixed delay: no growth, no jitter, no cap. */
    public static RetryBackoff fixed() {
        return new RetryBackoff(1.0, Long.MAX_VALUE, 0.0);
    }

    /**
     * @param retryDelay base delay from the routing row
     * @param retryIndex zero-based index of the retry that just failed
     */
    public Duration delay(final Duration retryDelay, final int retryIndex) {
        final long initialMs = retryDelay.toMillis();
        if (initialMs <= 0) return Duration.ZERO;
        final long base   = (long) (initialMs * Math.pow(factor, retryIndex));
        final long jitter = jitterRatio > 0
                ? (long) (ThreadLocalRandom.current().nextDouble() * initialMs * jitterRatio)
                : 0L;
        return Duration.ofMillis(Math.min(base + jitter, maxDelayMs));
    }
}
