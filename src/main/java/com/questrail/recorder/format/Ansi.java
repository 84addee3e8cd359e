package com.questrail.recorder.format;

/**
 * ANSI SGR escape sequences used by the recorder.
 */
public final class Ansi
{
    /**
     * Control sequence introducer: ESC followed by {@code [}.
     */
    public static final String ESCAPE_PREFIX = "\u001B[";

    /**
     * Resets all text attributes to the terminal default.
     */
    public static final String RESET = ESCAPE_PREFIX + "0m";

    public static final String DIM_GRAY = ESCAPE_PREFIX + "90m";
    public static final String BRIGHT_RED = ESCAPE_PREFIX + "91m";
    public static final String BRIGHT_GREEN = ESCAPE_PREFIX + "92m";
    public static final String BRIGHT_YELLOW = ESCAPE_PREFIX + "93m";
    public static final String BRIGHT_BLUE = ESCAPE_PREFIX + "94m";
    public static final String BRIGHT_MAGENTA = ESCAPE_PREFIX + "95m";
    public static final String YELLOW = ESCAPE_PREFIX + "33m";

    private Ansi() {}

    /**
     * Foreground color from the 256-color palette.
     */
    public static String foreground256(int index) {
        if (index < 0 || index > 255) {
            throw new IllegalArgumentException("palette index must be 0–255 (was " + index + ")");
        }
        return ESCAPE_PREFIX + "38;5;" + index + "m";
    }

    /**
     * Wraps {@code text} in {@code escape} and a trailing reset.
     */
    public static String wrap(String escape, String text) {
        return escape + text + RESET;
    }
}
