package com.camfleet.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff used when a telemetry subscription has to reconnect.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Many consoles may lose the same device at once (e.g. a Wi-Fi drop), the jitter keeps
 * them from reconnecting in lockstep.
 * </p>
 */
public final class JitterBackoff {

    /**
     * Default policy for device telemetry reconnects: 2s base, 30s cap, 1s jitter.
     */
    public static final JitterBackoff TELEMETRY = new JitterBackoff(
            Duration.ofSeconds(2),
            Duration.ofSeconds(30),
            Duration.ofSeconds(1)
    );

    private final Duration base;
    private final Duration max;
    private final Duration jitterMax;

    public JitterBackoff(Duration base, Duration max, Duration jitterMax) {
        if (base.isNegative() || max.compareTo(base) < 0 || jitterMax.isNegative()) {
            throw new IllegalArgumentException("Invalid backoff: base=" + base + ", max=" + max + ", jitter=" + jitterMax);
        }
        this.base = base;
        this.max = max;
        this.jitterMax = jitterMax;
    }

    /**
     * Computes the delay before the given retry attempt.
     *
     * @param attempt retry attempt number (0-based)
     * @return delay, never above {@code max + jitterMax}
     */
    public Duration next(long attempt) {
        long baseMs = base.toMillis();
        // Cap exponent to avoid overflow
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }

    public Duration getMax() {
        return max;
    }
}
