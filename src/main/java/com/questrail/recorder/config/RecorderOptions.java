package com.questrail.recorder.config;

import com.questrail.recorder.api.Tag;
import com.questrail.recorder.api.TagColor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Presentation options for an event recorder.
 *
 * <h2>Options</h2>
 * <ul>
 *   <li><b>useAnsiEscapeCodes</b> — color and dim output with SGR escape
 *       sequences. As a general rule a console supports them when
 *       {@code TERM} is set and the stream is interactive; see
 *       {@link #detect(Map, boolean)}.</li>
 *   <li><b>use256ColorAnsiEscapeCodes</b> — render tag colors with the
 *       256-color palette. Ignored unless ANSI escape codes are used.</li>
 *   <li><b>useIconographicSymbols</b> — use SF&nbsp;Symbols glyphs from the
 *       Unicode Private Use Area. Honored only on {@link Platform#MAC_OS}, and
 *       only meaningful when the symbols font is installed.</li>
 *   <li><b>tagColors</b> — override maps from tag to color, in the order they
 *       were supplied. Tags with a color are shown as colored dots before the
 *       test name. Ignored unless ANSI escape codes are used.</li>
 * </ul>
 *
 * <p>
 * The built-in tags {@link Tag#RED}, {@link Tag#ORANGE}, {@link Tag#YELLOW},
 * {@link Tag#GREEN}, {@link Tag#BLUE} and {@link Tag#PURPLE} always have their
 * own color and cannot be overridden. When several override maps bind the
 * same tag, the first map supplied wins.
 * </p>
 */
public record RecorderOptions(
        boolean useAnsiEscapeCodes,
        boolean use256ColorAnsiEscapeCodes,
        boolean useIconographicSymbols,
        List<Map<Tag, TagColor>> tagColors,
        Platform platform,
        EnvironmentInfo environment
) {
    public RecorderOptions {
        Objects.requireNonNull(tagColors, "tagColors");
        tagColors = tagColors.stream().map(Map::copyOf).toList();
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(environment, "environment");
    }

    /**
     * Plain-text options for the current platform.
     */
    public static RecorderOptions defaults() {
        return builder().build();
    }

    /**
     * Derives ANSI support from environment variables.
     *
     * <p>ANSI escape codes are used when the output is interactive, {@code TERM}
     * is set to something other than {@code dumb}, and {@code NO_COLOR} is not
     * set. 256 colors are used when {@code TERM} mentions {@code 256color} or
     * {@code COLORTERM} announces true color.</p>
     *
     * @param env         environment variables, typically {@link System#getenv()}
     * @param interactive whether the output stream is a console
     */
    public static Builder detect(Map<String, String> env, boolean interactive) {
        Objects.requireNonNull(env, "env");
        String term = env.getOrDefault("TERM", "");
        boolean ansi = interactive
                && !term.isEmpty()
                && !"dumb".equals(term)
                && !env.containsKey("NO_COLOR");
        String colorTerm = env.getOrDefault("COLORTERM", "").toLowerCase(Locale.ROOT);
        boolean extended = term.contains("256color")
                || colorTerm.equals("truecolor")
                || colorTerm.equals("24bit");
        return builder()
                .withAnsiEscapeCodes(ansi)
                .with256ColorAnsiEscapeCodes(ansi && extended);
    }

    /**
     * Whether tag colors should use the 256-color palette.
     */
    public boolean uses256Colors() {
        return useAnsiEscapeCodes && use256ColorAnsiEscapeCodes;
    }

    /**
     * Whether iconographic glyphs are both requested and available.
     */
    public boolean usesIconographicSymbols() {
        return useIconographicSymbols && platform == Platform.MAC_OS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean useAnsiEscapeCodes;
        private boolean use256ColorAnsiEscapeCodes;
        private boolean useIconographicSymbols;
        private final List<Map<Tag, TagColor>> tagColors = new ArrayList<>();
        private Platform platform = Platform.current();
        private EnvironmentInfo environment;

        public Builder withAnsiEscapeCodes(boolean enabled) {
            this.useAnsiEscapeCodes = enabled;
            return this;
        }

        public Builder with256ColorAnsiEscapeCodes(boolean enabled) {
            this.use256ColorAnsiEscapeCodes = enabled;
            return this;
        }

        public Builder withIconographicSymbols(boolean enabled) {
            this.useIconographicSymbols = enabled;
            return this;
        }

        /**
         * Adds a tag-color override map. May be called more than once.
         */
        public Builder withTagColors(Map<Tag, TagColor> tagColors) {
            this.tagColors.add(Objects.requireNonNull(tagColors, "tagColors"));
            return this;
        }

        public Builder withPlatform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public Builder withEnvironment(EnvironmentInfo environment) {
            this.environment = environment;
            return this;
        }

        public RecorderOptions build() {
            EnvironmentInfo env = environment != null ? environment : EnvironmentInfo.current();
            return new RecorderOptions(useAnsiEscapeCodes, use256ColorAnsiEscapeCodes,
                    useIconographicSymbols, tagColors, platform, env);
        }
    }
}
