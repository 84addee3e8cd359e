package com.questrail.recorder.format;

import com.questrail.recorder.config.Platform;
import com.questrail.recorder.config.RecorderOptions;

import java.util.EnumMap;
import java.util.Map;

/**
 * GlyphTable
 * -----------------------------------------------------------------------------
 * Interchangeable sets of glyphs for {@link Symbol}s and the comment arrow.
 *
 * <p>
 * Tables are plain data so every table can be exercised on every platform;
 * {@link #select(RecorderOptions)} decides which one a recorder uses.
 * </p>
 */
public enum GlyphTable {
    /** Standard Unicode glyphs; the fallback everywhere. */
    UNICODE(glyphs(
            "\u25C7",        // WHITE DIAMOND
            "\u2718",        // HEAVY BALLOT X
            "\u2714",        // HEAVY CHECK MARK
            "\u2718",
            "\u2718",
            "\u00B1",        // PLUS-MINUS SIGN
            "\u26A0\uFE0E"   // WARNING SIGN, text presentation
    ), "\u21B3", false),

    /** Glyphs present in the default Windows console font. */
    LIMITED_CONSOLE(glyphs(
            "\u25CA",        // LOZENGE
            "\u00D7",        // MULTIPLICATION SIGN
            "\u221A",        // SQUARE ROOT
            "\u00D7",
            "\u00D7",
            "\u00B1",
            "!"
    ), "\u21B3", false),

    /** SF Symbols from the Private Use Area. */
    ICONOGRAPHIC(glyphs(
            Character.toString(0x1007C8),  // diamond
            Character.toString(0x10065F),  // arrow.triangle.turn.up.right.diamond.fill
            Character.toString(0x10105B),  // checkmark.diamond.fill
            Character.toString(0x100884),  // xmark.diamond.fill
            Character.toString(0x100884),
            Character.toString(0x10017A),  // plus.forwardslash.minus
            Character.toString(0x1001FF)   // exclamationmark.triangle.fill
    ), Character.toString(0x100135), true);

    private final Map<Symbol, String> glyphs;
    private final String arrow;
    private final boolean padsUnderAnsi;

    GlyphTable(Map<Symbol, String> glyphs, String arrow, boolean padsUnderAnsi) {
        this.glyphs = glyphs;
        this.arrow = arrow;
        this.padsUnderAnsi = padsUnderAnsi;
    }

    /**
     * Chooses the table for {@code options}: iconographic when requested and
     * available, the limited table on Windows, Unicode otherwise.
     */
    public static GlyphTable select(RecorderOptions options) {
        if (options.usesIconographicSymbols()) {
            return ICONOGRAPHIC;
        }
        if (options.platform() == Platform.WINDOWS) {
            return LIMITED_CONSOLE;
        }
        return UNICODE;
    }

    public String glyph(Symbol symbol) {
        return glyphs.get(symbol);
    }

    /**
     * Glyph that introduces each comment in a comment block.
     */
    public String arrow() {
        return arrow;
    }

    /**
     * Whether glyphs of this table are followed by a space when colored.
     * Private-use glyphs render wider than one cell in most terminals.
     */
    public boolean padsUnderAnsi() {
        return padsUnderAnsi;
    }

    private static Map<Symbol, String> glyphs(String defaultGlyph, String skip, String pass,
                                              String passWithKnownIssues, String fail,
                                              String difference, String warning) {
        Map<Symbol, String> map = new EnumMap<>(Symbol.class);
        map.put(Symbol.DEFAULT, defaultGlyph);
        map.put(Symbol.SKIP, skip);
        map.put(Symbol.PASS, pass);
        map.put(Symbol.PASS_WITH_KNOWN_ISSUES, passWithKnownIssues);
        map.put(Symbol.FAIL, fail);
        map.put(Symbol.DIFFERENCE, difference);
        map.put(Symbol.WARNING, warning);
        return map;
    }
}
