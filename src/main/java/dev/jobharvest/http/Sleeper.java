package dev.jobharvest.http;

import java.time.Duration;

/**
 * Blocking pause, injectable so that tests can observe waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + duration.toMillis() + "ms", e);
        }
    };

    void sleep(Duration duration);
}
