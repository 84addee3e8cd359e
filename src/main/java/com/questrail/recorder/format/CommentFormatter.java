package com.questrail.recorder.format;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.config.RecorderOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders comment blocks.
 *
 * <pre>
 * ↳ first comment
 * ↳ second comment, line one
 *   second comment, line two
 * </pre>
 *
 * The block is dimmed when ANSI escape codes are enabled.
 */
public final class CommentFormatter
{
    private CommentFormatter() {}

    /**
     * Formats {@code comments}, or returns empty if there are none.
     */
    public static Optional<String> format(List<Comment> comments, RecorderOptions options) {
        if (comments.isEmpty()) {
            return Optional.empty();
        }

        String arrow = GlyphTable.select(options).arrow();
        if (options.usesIconographicSymbols() && options.useAnsiEscapeCodes()) {
            arrow += " ";
        }

        List<String> lines = new ArrayList<>();
        for (Comment comment : comments) {
            boolean first = true;
            for (String line : comment.rawValue().split("\\R")) {
                if (line.isEmpty()) {
                    continue;
                }
                lines.add(first ? arrow + " " + line : "  " + line);
                first = false;
            }
        }

        if (lines.isEmpty()) {
            return Optional.empty();
        }
        String block = String.join("\n", lines);
        if (options.useAnsiEscapeCodes()) {
            return Optional.of(Ansi.wrap(Ansi.DIM_GRAY, block));
        }
        return Optional.of(block);
    }
}
