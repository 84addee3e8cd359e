package com.questrail.recorder.api;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Display color bound to a {@link Tag}.
 *
 * <p>
 * Colors are plain RGB triples. Six named colors exist for the built-in tags;
 * any other triple is a custom color. Colors order by red, then green, then
 * blue component, which keeps multi-color output deterministic.
 * </p>
 */
public record TagColor(int red, int green, int blue) implements Comparable<TagColor> {

    public static final TagColor RED = new TagColor(255, 0, 0);
    public static final TagColor ORANGE = new TagColor(255, 128, 0);
    public static final TagColor YELLOW = new TagColor(255, 255, 0);
    public static final TagColor GREEN = new TagColor(0, 255, 0);
    public static final TagColor BLUE = new TagColor(0, 0, 255);
    public static final TagColor PURPLE = new TagColor(128, 0, 255);

    private static final Map<String, TagColor> NAMED = Map.of(
            "red", RED,
            "orange", ORANGE,
            "yellow", YELLOW,
            "green", GREEN,
            "blue", BLUE,
            "purple", PURPLE
    );

    private static final Comparator<TagColor> ORDER = Comparator
            .comparingInt(TagColor::red)
            .thenComparingInt(TagColor::green)
            .thenComparingInt(TagColor::blue);

    public TagColor {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Parses a color from configuration text.
     *
     * <p>Accepts one of the six color names (case-insensitive) or a
     * {@code #rrggbb} hex string.</p>
     *
     * @throws IllegalArgumentException if the text is neither
     */
    public static TagColor parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        TagColor named = NAMED.get(trimmed.toLowerCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        if (trimmed.length() == 7 && trimmed.charAt(0) == '#') {
            try {
                int rgb = Integer.parseInt(trimmed.substring(1), 16);
                return new TagColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid hex color: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unrecognized tag color: " + text);
    }

    @Override
    public int compareTo(TagColor other) {
        return ORDER.compare(this, other);
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(
                    name + " component must be in range 0–255 (was " + value + ")");
        }
    }
}
