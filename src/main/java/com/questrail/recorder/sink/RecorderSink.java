package com.questrail.recorder.sink;

/**
 * Destination for recorder output.
 *
 * <p>
 * Implementations may be called concurrently from any thread that posts
 * events, and must provide whatever ordering or atomicity their destination
 * needs. Write failures are the sink's own concern; the recorder does not
 * retry.
 * </p>
 */
@FunctionalInterface
public interface RecorderSink {
    /**
     * Writes one piece of output. {@code text} is newline-terminated and may
     * span several lines.
     */
    void write(String text);
}
