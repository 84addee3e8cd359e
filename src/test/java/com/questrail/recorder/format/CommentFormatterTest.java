package com.questrail.recorder.format;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.config.EnvironmentInfo;
import com.questrail.recorder.config.Platform;
import com.questrail.recorder.config.RecorderOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommentFormatterTest {

    private static RecorderOptions.Builder options() {
        return RecorderOptions.builder()
                .withPlatform(Platform.LINUX)
                .withEnvironment(new EnvironmentInfo("1.0", "17", "TestOS 1"));
    }

    @Test
    void noCommentsMeansNoBlock() {
        assertTrue(CommentFormatter.format(List.of(), options().build()).isEmpty());
    }

    @Test
    void arrowPrefixesFirstLineAndContinuationIsIndented() {
        List<Comment> comments = List.of(
                Comment.of("first"),
                Comment.of("second, line one\nsecond, line two"));

        String block = CommentFormatter.format(comments, options().build()).orElseThrow();

        assertEquals("↳ first\n↳ second, line one\n  second, line two", block);
    }

    @Test
    void blankLinesAreDropped() {
        String block = CommentFormatter.format(List.of(Comment.of("a\r\n\r\nb")), options().build())
                .orElseThrow();

        assertEquals("↳ a\n  b", block);
    }

    @Test
    void ansiDimsTheWholeBlock() {
        String block = CommentFormatter.format(List.of(Comment.of("note")),
                options().withAnsiEscapeCodes(true).build()).orElseThrow();

        assertEquals("\u001B[90m↳ note\u001B[0m", block);
    }
}
