package com.questrail.recorder.api;

import java.util.Objects;

/**
 * Free-text remark attached to a test, an issue or a skip.
 *
 * May span several lines.
 */
public record Comment(String rawValue) {
    public Comment {
        Objects.requireNonNull(rawValue, "rawValue");
    }

    public static Comment of(String rawValue) {
        return new Comment(rawValue);
    }

    @Override
    public String toString() {
        return rawValue;
    }
}
