package com.camfleet.device.http;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Minimum-interval limiter for one path class.
 * <p>
 * Holds the timestamp of the last accepted request. The timestamp only moves on acceptance, so
 * a burst of rejected requests does not push the next allowed slot further out.
 * </p>
 */
public class RateLimiter {
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Object lock = new Object();

    private long lastAcceptedNanos;
    private boolean accepted;

    public RateLimiter(Duration minInterval) {
        this(minInterval, System::nanoTime);
    }

    public RateLimiter(Duration minInterval, LongSupplier nanoClock) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("Negative interval: " + minInterval);
        }
        this.intervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Accepts the request and records it, or rejects it.
     *
     * @return empty when accepted, otherwise the remaining wait in milliseconds
     * (between 0 and the interval)
     */
    public OptionalLong tryAcquire() {
        synchronized (lock) {
            long now = nanoClock.getAsLong();
            if (accepted) {
                long elapsed = now - lastAcceptedNanos;
                if (elapsed < intervalNanos) {
                    return OptionalLong.of(TimeUnit.NANOSECONDS.toMillis(intervalNanos - Math.max(elapsed, 0)));
                }
            }
            lastAcceptedNanos = now;
            accepted = true;
            return OptionalLong.empty();
        }
    }

    public long getIntervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
