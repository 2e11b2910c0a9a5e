package dev.jobharvest.http;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Minimum-interval gate shared by all callers of one external-service client.
 * Callers queue on the gate: a second caller waits until the first has been
 * released and the interval has elapsed.
 */
@Slf4j
public class RateGate {

    private final String name;
    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastAcquiredAt = Long.MIN_VALUE;

    public RateGate(String name, Duration minInterval) {
        this(name, minInterval, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateGate(String name, Duration minInterval, Clock clock, Sleeper sleeper) {
        this.name = name;
        this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least the minimum interval has passed since the previous acquisition.
     */
    public synchronized void acquire() {
        long now = clock.millis();
        if (lastAcquiredAt != Long.MIN_VALUE) {
            long waitMs = lastAcquiredAt + minInterval.toMillis() - now;
            if (waitMs > 0) {
                log.debug("Rate gate '{}' waiting {}ms", name, waitMs);
                sleeper.sleep(Duration.ofMillis(waitMs));
            }
        }
        lastAcquiredAt = clock.millis();
    }
}
