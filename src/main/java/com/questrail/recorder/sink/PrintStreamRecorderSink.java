package com.questrail.recorder.sink;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes recorder output to a {@link PrintStream}, typically standard output.
 *
 * <p>Each write is printed and flushed while holding the stream's monitor, so
 * output of concurrent events never interleaves within one event.</p>
 */
public final class PrintStreamRecorderSink implements RecorderSink {
    private final PrintStream out;

    public PrintStreamRecorderSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * A sink writing UTF-8 to the process's standard output.
     */
    public static PrintStreamRecorderSink standardOutput() {
        return new PrintStreamRecorderSink(
                new PrintStream(new FileOutputStream(FileDescriptor.out), false, StandardCharsets.UTF_8));
    }

    @Override
    public void write(String text) {
        synchronized (out) {
            out.print(text);
            out.flush();
        }
    }
}
