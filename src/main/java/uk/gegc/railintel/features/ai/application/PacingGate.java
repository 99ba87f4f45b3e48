package uk.gegc.railintel.features.ai.application;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide gate enforcing a minimum spacing between provider calls.
 * <p>
 * One instance is shared by every caller, because the provider's quota is global. Callers queue
 * on a fair lock, so concurrent requests are released one at a time, in arrival order, each at
 * least {@code minimumSpacing} after the previous one.
 */
@Slf4j
public class PacingGate {

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration minimumSpacing;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private Instant lastCallStart;

    public PacingGate(Clock clock, Sleeper sleeper, Duration minimumSpacing) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.minimumSpacing = minimumSpacing == null || minimumSpacing.isNegative()
                ? Duration.ZERO
                : minimumSpacing;
    }

    /**
     * Blocks until the caller may start its call and records the start.
     *
     * @return how long the caller waited
     */
    public Duration acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            Duration waited = Duration.ZERO;
            if (lastCallStart != null) {
                Duration remaining = Duration.between(clock.instant(), lastCallStart.plus(minimumSpacing));
                if (!remaining.isNegative() && !remaining.isZero()) {
                    log.debug("Pacing gate holding caller for {} ms", remaining.toMillis());
                    sleeper.sleep(remaining);
                    waited = remaining;
                }
            }
            lastCallStart = clock.instant();
            return waited;
        } finally {
            lock.unlock();
        }
    }

    public Duration getMinimumSpacing() {
        return minimumSpacing;
    }
}
