package com.questrail.recorder.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared parameter of a parameterized test function.
 *
 * <p>
 * A parameter has a first name (its external label) and optionally a second
 * name (its internal name). A first name of {@value #PLACEHOLDER} with no second
 * name means the parameter is unlabeled.
 * </p>
 */
public final class ParameterInfo
{
    /**
     * Name used for parameters that carry no label.
     */
    public static final String PLACEHOLDER = "_";

    private final int index;
    private final String firstName;
    private final String secondName;

    public ParameterInfo(int index, String firstName, String secondName) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (was " + index + ")");
        }
        this.index = index;
        this.firstName = Objects.requireNonNull(firstName, "firstName");
        this.secondName = secondName;
    }

    public static ParameterInfo named(int index, String name) {
        return new ParameterInfo(index, name, null);
    }

    public static ParameterInfo unlabeled(int index) {
        return new ParameterInfo(index, PLACEHOLDER, null);
    }

    public int index() {
        return index;
    }

    public String firstName() {
        return firstName;
    }

    public Optional<String> secondName() {
        return Optional.ofNullable(secondName);
    }

    /**
     * Returns the label shown next to an argument: the second name when
     * present, otherwise the first name.
     */
    public String label() {
        return secondName != null ? secondName : firstName;
    }

    /**
     * Returns {@code true} if this parameter has a real name.
     */
    public boolean isLabeled() {
        return !PLACEHOLDER.equals(label());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterInfo that)) return false;
        return index == that.index
                && firstName.equals(that.firstName)
                && Objects.equals(secondName, that.secondName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, firstName, secondName);
    }

    @Override
    public String toString() {
        return "ParameterInfo[" + index + ", " + firstName
                + (secondName != null ? " " + secondName : "") + "]";
    }
}
