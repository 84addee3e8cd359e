package com.questrail.recorder.api;

import java.util.Objects;
import java.util.Optional;

/**
 * User-assigned label on a test.
 *
 * <h2>Raw value and source code</h2>
 * <p>
 * A tag is identified by its raw value. A tag declared through a member
 * expression such as {@code .critical} also remembers that expression as its
 * source code, so a color configured under the key {@code ".critical"} can be
 * found even when the raw value differs.
 * </p>
 *
 * <p>
 * <b>Equality and hash code are based on the raw value only.</b> The source
 * code is descriptive metadata.
 * </p>
 */
public final class Tag
{
    public static final Tag RED = member("red");
    public static final Tag ORANGE = member("orange");
    public static final Tag YELLOW = member("yellow");
    public static final Tag GREEN = member("green");
    public static final Tag BLUE = member("blue");
    public static final Tag PURPLE = member("purple");

    private final String rawValue;
    private final String sourceCode;

    private Tag(String rawValue, String sourceCode) {
        this.rawValue = Objects.requireNonNull(rawValue, "rawValue");
        this.sourceCode = sourceCode;
    }

    /**
     * Creates a tag from a plain string value.
     */
    public static Tag of(String rawValue) {
        return new Tag(rawValue, null);
    }

    /**
     * Creates a tag declared as a static member, e.g. {@code member("critical")}
     * for {@code .critical}.
     */
    public static Tag member(String name) {
        Objects.requireNonNull(name, "name");
        return new Tag("." + name, "." + name);
    }

    /**
     * Creates a tag with an explicit raw value and the source expression it was
     * declared with.
     */
    public static Tag withSourceCode(String rawValue, String sourceCode) {
        return new Tag(rawValue, Objects.requireNonNull(sourceCode, "sourceCode"));
    }

    public String rawValue() {
        return rawValue;
    }

    /**
     * Returns the source expression this tag was declared with, if known.
     */
    public Optional<String> sourceCode() {
        return Optional.ofNullable(sourceCode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tag that)) return false;
        return rawValue.equals(that.rawValue);
    }

    @Override
    public int hashCode() {
        return rawValue.hashCode();
    }

    @Override
    public String toString() {
        return rawValue;
    }
}
