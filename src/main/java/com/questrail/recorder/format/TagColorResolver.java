package com.questrail.recorder.format;

import com.questrail.recorder.api.Tag;
import com.questrail.recorder.api.TagColor;
import com.questrail.recorder.config.RecorderOptions;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * TagColorResolver
 * -----------------------------------------------------------------------------
 * Resolves test tags to colors and renders them as colored dots.
 *
 * <h2>Merge order</h2>
 * <ol>
 *   <li>The six built-in bindings ({@code .red → red}, ...) always win.</li>
 *   <li>Override maps from {@link RecorderOptions#tagColors()} follow in the
 *       order given; for a tag bound by several maps, the first map wins.</li>
 * </ol>
 *
 * <h2>Rendering</h2>
 * Each distinct color becomes its escape sequence followed by {@code ●},
 * sorted by color, with a single reset after the last dot. Colors without an
 * escape in the active palette are left out.
 */
public final class TagColorResolver
{
    static final String DOT = "\u25CF"; // BLACK CIRCLE

    private static final Map<Tag, TagColor> PREDEFINED = Map.of(
            Tag.RED, TagColor.RED,
            Tag.ORANGE, TagColor.ORANGE,
            Tag.YELLOW, TagColor.YELLOW,
            Tag.GREEN, TagColor.GREEN,
            Tag.BLUE, TagColor.BLUE,
            Tag.PURPLE, TagColor.PURPLE
    );

    private static final Map<TagColor, String> SIXTEEN_COLOR = Map.of(
            TagColor.RED, Ansi.BRIGHT_RED,
            TagColor.ORANGE, Ansi.YELLOW,
            TagColor.YELLOW, Ansi.BRIGHT_YELLOW,
            TagColor.GREEN, Ansi.BRIGHT_GREEN,
            TagColor.BLUE, Ansi.BRIGHT_BLUE,
            TagColor.PURPLE, Ansi.BRIGHT_MAGENTA
    );

    private final RecorderOptions options;
    private final Map<Tag, TagColor> tagColors;

    public TagColorResolver(RecorderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.tagColors = merge(options);
    }

    /**
     * The effective tag-color map.
     */
    public Map<Tag, TagColor> tagColors() {
        return tagColors;
    }

    /**
     * Looks up the color of {@code tag}, falling back to the key its source
     * expression would produce.
     */
    public Optional<TagColor> colorOf(Tag tag) {
        TagColor color = tagColors.get(tag);
        if (color != null) {
            return Optional.of(color);
        }
        return tag.sourceCode().map(Tag::of).map(tagColors::get);
    }

    /**
     * Renders the colors of {@code tags} as dots followed by one reset, or
     * the empty string when ANSI is off or no tag has a renderable color.
     */
    public String colorDots(Collection<Tag> tags) {
        if (!options.useAnsiEscapeCodes()) {
            return "";
        }
        TreeSet<TagColor> colors = new TreeSet<>();
        for (Tag tag : tags) {
            colorOf(tag).ifPresent(colors::add);
        }

        StringBuilder dots = new StringBuilder();
        for (TagColor color : colors) {
            escapeFor(color).ifPresent(escape -> dots.append(escape).append(DOT));
        }
        if (dots.length() == 0) {
            return "";
        }
        return dots.append(Ansi.RESET).toString();
    }

    /**
     * Returns the foreground escape for {@code color} in the active palette.
     *
     * <p>The 16-color palette only covers the six named colors. The 256-color
     * palette maps each channel linearly onto 0–5 and picks the matching entry
     * of the color cube.</p>
     */
    public Optional<String> escapeFor(TagColor color) {
        if (!options.useAnsiEscapeCodes()) {
            return Optional.empty();
        }
        if (options.uses256Colors()) {
            int r = color.red() * 5 / 255;
            int g = color.green() * 5 / 255;
            int b = color.blue() * 5 / 255;
            return Optional.of(Ansi.foreground256(16 + 36 * r + 6 * g + b));
        }
        return Optional.ofNullable(SIXTEEN_COLOR.get(color));
    }

    private static Map<Tag, TagColor> merge(RecorderOptions options) {
        Map<Tag, TagColor> merged = new HashMap<>(PREDEFINED);
        for (Map<Tag, TagColor> overrides : options.tagColors()) {
            overrides.forEach(merged::putIfAbsent);
        }
        return Map.copyOf(merged);
    }
}
