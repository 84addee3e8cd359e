package com.questrail.recorder.api;

import java.util.Objects;
import java.util.Optional;

/**
 * An evaluated expectation such as {@code #expect(x == 2)}.
 *
 * <p>
 * {@code expandedDescription} shows the expression with captured values, e.g.
 * {@code "(x → 1) == 2"}. {@code differenceDescription} is present when the
 * compared values support a structural diff.
 * </p>
 */
public final class Expectation
{
    private final String expandedDescription;
    private final boolean passed;
    private final String differenceDescription;

    public Expectation(String expandedDescription, boolean passed, String differenceDescription) {
        this.expandedDescription = Objects.requireNonNull(expandedDescription, "expandedDescription");
        this.passed = passed;
        this.differenceDescription = differenceDescription;
    }

    public static Expectation failed(String expandedDescription) {
        return new Expectation(expandedDescription, false, null);
    }

    public static Expectation failed(String expandedDescription, String differenceDescription) {
        return new Expectation(expandedDescription, false,
                Objects.requireNonNull(differenceDescription, "differenceDescription"));
    }

    public String expandedDescription() {
        return expandedDescription;
    }

    public boolean isPassing() {
        return passed;
    }

    public Optional<String> differenceDescription() {
        return Optional.ofNullable(differenceDescription);
    }

    @Override
    public String toString() {
        return expandedDescription;
    }
}
