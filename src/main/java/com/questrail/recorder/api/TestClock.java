package com.questrail.recorder.api;

/**
 * TestClock
 * =============================================================================
 * Time source for stamping test events.
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time reporting MUST use a monotonic time source. Wall-clock time
 * (e.g. {@code Instant.now()}) can jump under NTP or manual adjustment and
 * would produce nonsensical durations.
 *
 * <p>
 * Implementations should be backed by {@link System#nanoTime()} or an
 * equivalent monotonic counter.
 * </p>
 */
public interface TestClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     */
    long nowNanos();

    /**
     * Returns the current instant of this clock.
     */
    default TestInstant now() {
        return TestInstant.ofNanos(nowNanos());
    }
}
