package com.questrail.recorder.api;

import java.util.Objects;

/**
 * Location in test source code where an issue was recorded.
 */
public record SourceLocation(String fileId, int line, int column) {
    public SourceLocation {
        Objects.requireNonNull(fileId, "fileId");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based (was "
                    + line + ":" + column + ")");
        }
    }

    @Override
    public String toString() {
        return fileId + ":" + line + ":" + column;
    }
}
