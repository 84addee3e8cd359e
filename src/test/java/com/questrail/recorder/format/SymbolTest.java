package com.questrail.recorder.format;

import com.questrail.recorder.config.EnvironmentInfo;
import com.questrail.recorder.config.Platform;
import com.questrail.recorder.config.RecorderOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTest {

    private static RecorderOptions.Builder options(Platform platform) {
        return RecorderOptions.builder()
                .withPlatform(platform)
                .withEnvironment(new EnvironmentInfo("1.0", "17", "TestOS 1"));
    }

    @Test
    void unicodeGlyphsWithoutAnsi() {
        RecorderOptions plain = options(Platform.LINUX).build();

        assertEquals("◇", Symbol.DEFAULT.render(plain));
        assertEquals("✘", Symbol.SKIP.render(plain));
        assertEquals("✔", Symbol.pass(false).render(plain));
        assertEquals("✘", Symbol.pass(true).render(plain));
        assertEquals("✘", Symbol.FAIL.render(plain));
        assertEquals("±", Symbol.DIFFERENCE.render(plain));
        assertEquals("\u26A0\uFE0E", Symbol.WARNING.render(plain));
    }

    @Test
    void ansiColorsEachGlyphAndResets() {
        RecorderOptions ansi = options(Platform.LINUX).withAnsiEscapeCodes(true).build();

        assertEquals("\u001B[90m◇\u001B[0m", Symbol.DEFAULT.render(ansi));
        assertEquals("\u001B[90m✘\u001B[0m", Symbol.SKIP.render(ansi));
        assertEquals("\u001B[90m±\u001B[0m", Symbol.DIFFERENCE.render(ansi));
        assertEquals("\u001B[92m✔\u001B[0m", Symbol.PASS.render(ansi));
        assertEquals("\u001B[90m✘\u001B[0m", Symbol.PASS_WITH_KNOWN_ISSUES.render(ansi));
        assertEquals("\u001B[91m✘\u001B[0m", Symbol.FAIL.render(ansi));
        assertEquals("\u001B[93m\u26A0\uFE0E\u001B[0m", Symbol.WARNING.render(ansi));
    }

    @Test
    void iconographicGlyphsRequireMacOs() {
        RecorderOptions linux = options(Platform.LINUX).withIconographicSymbols(true).build();
        RecorderOptions mac = options(Platform.MAC_OS).withIconographicSymbols(true).build();

        assertEquals(GlyphTable.UNICODE, GlyphTable.select(linux));
        assertEquals(GlyphTable.ICONOGRAPHIC, GlyphTable.select(mac));
        assertEquals(Character.toString(0x10105B), Symbol.PASS.render(mac));
    }

    @Test
    void iconographicGlyphsArePaddedWhenColored() {
        RecorderOptions mac = options(Platform.MAC_OS)
                .withIconographicSymbols(true)
                .withAnsiEscapeCodes(true)
                .build();

        assertEquals("\u001B[91m" + Character.toString(0x100884) + " \u001B[0m", Symbol.FAIL.render(mac));
    }

    @Test
    void windowsUsesLimitedConsoleGlyphs() {
        RecorderOptions windows = options(Platform.WINDOWS).build();

        assertEquals(GlyphTable.LIMITED_CONSOLE, GlyphTable.select(windows));
        assertEquals("√", Symbol.PASS.render(windows));
        assertEquals("!", Symbol.WARNING.render(windows));
    }

    @Test
    void everyTableCoversEverySymbol() {
        for (GlyphTable table : GlyphTable.values()) {
            for (Symbol symbol : Symbol.values()) {
                assertNotNull(table.glyph(symbol), table + " lacks " + symbol);
            }
            assertFalse(table.arrow().isEmpty());
        }
    }
}
