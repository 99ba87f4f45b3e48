package uk.gegc.railintel.features.ai.application;

import java.time.Duration;

/**
 * Blocking wait used for pacing and backoff. Replaced in tests to avoid real sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
