package com.questrail.recorder.format;

import com.questrail.recorder.api.TestInstant;

import java.time.Duration;
import java.util.Locale;

/**
 * Elapsed-time text such as {@code "0.042 seconds"}.
 */
public final class DurationFormatter
{
    private DurationFormatter() {}

    /**
     * Describes the time elapsed from {@code start} to {@code end}.
     * An end that precedes the start (clock skew between threads) reads as zero.
     */
    public static String describe(TestInstant start, TestInstant end) {
        return describe(start.durationTo(end));
    }

    /**
     * Describes {@code duration} with millisecond precision; negative
     * durations are clamped to zero.
     */
    public static String describe(Duration duration) {
        Duration clamped = duration.isNegative() ? Duration.ZERO : duration;
        return String.format(Locale.ROOT, "%d.%03d seconds", clamped.getSeconds(), clamped.toMillisPart());
    }
}
