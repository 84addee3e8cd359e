package com.questrail.recorder.format;

import com.questrail.recorder.api.Tag;
import com.questrail.recorder.api.TagColor;
import com.questrail.recorder.config.EnvironmentInfo;
import com.questrail.recorder.config.Platform;
import com.questrail.recorder.config.RecorderOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagColorResolverTest {

    private static RecorderOptions.Builder ansi() {
        return RecorderOptions.builder()
                .withPlatform(Platform.LINUX)
                .withEnvironment(new EnvironmentInfo("1.0", "17", "TestOS 1"))
                .withAnsiEscapeCodes(true);
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    void builtInTagsHaveColorsWithoutConfiguration() {
        TagColorResolver resolver = new TagColorResolver(ansi().build());

        assertEquals(TagColor.RED, resolver.colorOf(Tag.RED).orElseThrow());
        assertEquals(TagColor.PURPLE, resolver.colorOf(Tag.PURPLE).orElseThrow());
        assertTrue(resolver.colorOf(Tag.of("untagged")).isEmpty());
    }

    @Test
    void twoColorsRenderTwoDotsAndOneResetInSortedOrder() {
        TagColorResolver resolver = new TagColorResolver(ansi().build());

        // Blue (0,0,255) sorts before red (255,0,0) regardless of tag order.
        String dots = resolver.colorDots(List.of(Tag.RED, Tag.BLUE));

        assertEquals("\u001B[94m●\u001B[91m●\u001B[0m", dots);
        assertEquals(2, occurrences(dots, "●"));
        assertEquals(1, occurrences(dots, Ansi.RESET));
        assertTrue(dots.endsWith(Ansi.RESET));
    }

    @Test
    void tagsSharingAColorRenderOneDot() {
        Tag critical = Tag.member("critical");
        TagColorResolver resolver = new TagColorResolver(ansi()
                .withTagColors(Map.of(critical, TagColor.RED))
                .build());

        String dots = resolver.colorDots(List.of(Tag.RED, critical));

        assertEquals("\u001B[91m●\u001B[0m", dots);
    }

    @Test
    void noDotsWhenAnsiIsDisabled() {
        RecorderOptions plain = RecorderOptions.builder()
                .withPlatform(Platform.LINUX)
                .withEnvironment(new EnvironmentInfo("1.0", "17", "TestOS 1"))
                .build();

        assertEquals("", new TagColorResolver(plain).colorDots(List.of(Tag.RED)));
    }

    @Test
    void customColorsHaveNoSixteenColorEscape() {
        Tag slow = Tag.of("slow");
        TagColorResolver resolver = new TagColorResolver(ansi()
                .withTagColors(Map.of(slow, new TagColor(10, 20, 30)))
                .build());

        assertTrue(resolver.escapeFor(new TagColor(10, 20, 30)).isEmpty());
        assertEquals("", resolver.colorDots(List.of(slow)));
    }

    @Test
    void twoHundredFiftySixColorIndexFromColorCube() {
        TagColorResolver resolver = new TagColorResolver(ansi().with256ColorAnsiEscapeCodes(true).build());

        // 16 + 36*5 + 6*0 + 0
        assertEquals("\u001B[38;5;196m", resolver.escapeFor(TagColor.RED).orElseThrow());
        // orange (255,128,0): g = 128*5/255 = 2 -> 16 + 180 + 12
        assertEquals("\u001B[38;5;208m", resolver.escapeFor(TagColor.ORANGE).orElseThrow());
        // (10,20,30) quantizes to (0,0,0)
        assertEquals("\u001B[38;5;16m", resolver.escapeFor(new TagColor(10, 20, 30)).orElseThrow());
        assertEquals("\u001B[38;5;231m", resolver.escapeFor(new TagColor(255, 255, 255)).orElseThrow());
    }

    @Test
    void builtInsCannotBeOverridden() {
        TagColorResolver resolver = new TagColorResolver(ansi()
                .withTagColors(Map.of(Tag.RED, TagColor.GREEN))
                .build());

        assertEquals(TagColor.RED, resolver.colorOf(Tag.RED).orElseThrow());
    }

    @Test
    void firstOverrideMapWinsOnCollision() {
        Tag flaky = Tag.of("flaky");
        TagColorResolver resolver = new TagColorResolver(ansi()
                .withTagColors(Map.of(flaky, TagColor.ORANGE))
                .withTagColors(Map.of(flaky, TagColor.BLUE, Tag.of("slow"), TagColor.YELLOW))
                .build());

        assertEquals(TagColor.ORANGE, resolver.colorOf(flaky).orElseThrow());
        assertEquals(TagColor.YELLOW, resolver.colorOf(Tag.of("slow")).orElseThrow());
    }

    @Test
    void fallsBackToSourceCodeKey() {
        Tag declared = Tag.withSourceCode("Critical Path", ".critical");
        TagColorResolver resolver = new TagColorResolver(ansi()
                .withTagColors(Map.of(Tag.of(".critical"), TagColor.PURPLE))
                .build());

        assertEquals(TagColor.PURPLE, resolver.colorOf(declared).orElseThrow());
    }
}
