package com.questrail.recorder.format;

import com.questrail.recorder.config.RecorderOptions;

/**
 * Symbols used as line prefixes in recorder output.
 *
 * <p>
 * The set is closed. The glyph for each symbol comes from a {@link GlyphTable};
 * with ANSI escape codes enabled it is also colored and followed by a reset.
 * </p>
 */
public enum Symbol {
    /** Neutral progress, e.g. a test started. */
    DEFAULT(Ansi.DIM_GRAY),
    SKIP(Ansi.DIM_GRAY),
    PASS(Ansi.BRIGHT_GREEN),
    /** Passed, but only because every issue was a known issue. */
    PASS_WITH_KNOWN_ISSUES(Ansi.DIM_GRAY),
    FAIL(Ansi.BRIGHT_RED),
    /** Prefix of an expectation's difference description. */
    DIFFERENCE(Ansi.DIM_GRAY),
    WARNING(Ansi.BRIGHT_YELLOW);

    private final String ansiColor;

    Symbol(String ansiColor) {
        this.ansiColor = ansiColor;
    }

    public static Symbol pass(boolean hasKnownIssues) {
        return hasKnownIssues ? PASS_WITH_KNOWN_ISSUES : PASS;
    }

    /**
     * Returns this symbol as it should appear in output under {@code options}.
     */
    public String render(RecorderOptions options) {
        GlyphTable table = GlyphTable.select(options);
        String glyph = table.glyph(this);
        if (!options.useAnsiEscapeCodes()) {
            return glyph;
        }
        if (table.padsUnderAnsi()) {
            glyph += " ";
        }
        return Ansi.wrap(ansiColor, glyph);
    }
}
