package com.questrail.recorder.api;

import java.time.Duration;

/**
 * Point in monotonic test time.
 *
 * <p>
 * Values are nanoseconds from an arbitrary origin (typically
 * {@link System#nanoTime()}) and are only meaningful relative to one another.
 * Wall-clock time plays no part in elapsed-time reporting.
 * </p>
 */
public record TestInstant(long nanos) implements Comparable<TestInstant> {

    public static TestInstant ofNanos(long nanos) {
        return new TestInstant(nanos);
    }

    /**
     * Returns the time elapsed from this instant to {@code end}.
     * Negative if {@code end} precedes this instant.
     */
    public Duration durationTo(TestInstant end) {
        return Duration.ofNanos(end.nanos - nanos);
    }

    public TestInstant plus(Duration duration) {
        return new TestInstant(nanos + duration.toNanos());
    }

    @Override
    public int compareTo(TestInstant other) {
        return Long.compare(nanos, other.nanos);
    }
}
