package com.tradeguard.connection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff between reconnect attempts: the delay starts at {@code initialDelay}, is
 * multiplied after every failed attempt up to {@code maxDelay}, and each returned delay is spread by
 * plus or minus {@code jitter} so many clients do not reconnect in lockstep. A successful connection
 * resets it.
 */
public class ReconnectBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    private Duration currentDelay;
    private int attemptCount;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay, double multiplier, double jitter) {
        this(initialDelay, maxDelay, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** {@code random} yields values in [0, 1) and decides where in the jitter band each delay lands. */
    public ReconnectBackoff(
            Duration initialDelay, Duration maxDelay, double multiplier, double jitter, DoubleSupplier random) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive");
        }
        if (initialDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("Initial delay cannot exceed max delay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("Jitter must be in [0, 1)");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
        this.currentDelay = initialDelay;
    }

    /** Delay to wait after the attempt just made, then grows the base delay for the next one. */
    public synchronized Duration nextDelay() {
        attemptCount++;
        double spread = 1 + jitter * (2 * random.getAsDouble() - 1);
        Duration delay = Duration.ofMillis(Math.round(currentDelay.toMillis() * spread));
        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        return delay;
    }

    public synchronized void reset() {
        attemptCount = 0;
        currentDelay = initialDelay;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }
}
