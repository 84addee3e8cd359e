package com.questrail.recorder.sink;

/**
 * No-op implementation of RecorderSink.
 */
public final class NullRecorderSink implements RecorderSink {
    public static final NullRecorderSink INSTANCE = new NullRecorderSink();

    private NullRecorderSink() {}

    @Override
    public void write(String text) {}
}
