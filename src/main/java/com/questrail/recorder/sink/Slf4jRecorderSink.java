package com.questrail.recorder.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Implementation of RecorderSink that emits each output line via SLF4J.
 *
 * <p>Useful when test output should end up in the application log rather
 * than on a console. Record with ANSI escape codes disabled.</p>
 */
public final class Slf4jRecorderSink implements RecorderSink {
    private static final Logger defaultLog = LoggerFactory.getLogger(Slf4jRecorderSink.class);

    private final Logger log;

    public Slf4jRecorderSink() {
        this(defaultLog);
    }

    public Slf4jRecorderSink(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void write(String text) {
        for (String line : text.split("\\R")) {
            if (!line.isEmpty()) {
                log.info("{}", line);
            }
        }
    }
}
