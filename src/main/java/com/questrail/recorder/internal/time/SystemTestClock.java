package com.questrail.recorder.internal.time;

import com.questrail.recorder.api.TestClock;

/**
 * SystemTestClock
 * =============================================================================
 * Production {@link TestClock} backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Monotonically non-decreasing within one JVM</li>
 *   <li>Not affected by wall-clock adjustments</li>
 *   <li>Only meaningful for elapsed time calculations</li>
 * </ul>
 *
 * <p>For deterministic testing, use a manually advanced clock instead.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe; {@link System#nanoTime()} may be called concurrently.</p>
 */
public enum SystemTestClock implements TestClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
