package com.questrail.recorder.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hierarchical identity of a test or suite.
 *
 * <h2>Key path</h2>
 * <p>
 * A {@code TestId} is a non-empty path of string components, typically the
 * module, the enclosing suites and finally the test function, e.g.
 * {@code ["MyModule", "ParserTests", "parsesEmptyInput()"]}. A suite's id is a
 * strict prefix of the ids of everything it contains.
 * </p>
 *
 * <h2>Equality</h2>
 * <p>
 * Equality and hash code are based on the full key path, so instances are
 * suitable as map keys. Subtree membership is answered by {@link #contains(TestId)}.
 * </p>
 */
public final class TestId
{
    private final List<String> keyPath;

    private TestId(List<String> keyPath) {
        this.keyPath = List.copyOf(keyPath);
    }

    /**
     * Creates an id from its key path components.
     *
     * @throws IllegalArgumentException if no components are given
     */
    public static TestId of(String... components) {
        return of(List.of(components));
    }

    /**
     * Creates an id from its key path.
     *
     * @throws IllegalArgumentException if the key path is empty
     */
    public static TestId of(List<String> keyPath) {
        Objects.requireNonNull(keyPath, "keyPath");
        if (keyPath.isEmpty()) {
            throw new IllegalArgumentException("TestId key path must not be empty");
        }
        return new TestId(keyPath);
    }

    /**
     * Returns the id of a direct child of this id.
     */
    public TestId child(String component) {
        Objects.requireNonNull(component, "component");
        List<String> path = new ArrayList<>(keyPath.size() + 1);
        path.addAll(keyPath);
        path.add(component);
        return new TestId(path);
    }

    public List<String> keyPath() {
        return keyPath;
    }

    /**
     * Returns {@code true} if {@code other} is this id or one of its descendants.
     */
    public boolean contains(TestId other) {
        Objects.requireNonNull(other, "other");
        if (other.keyPath.size() < keyPath.size()) {
            return false;
        }
        return other.keyPath.subList(0, keyPath.size()).equals(keyPath);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestId that)) return false;
        return keyPath.equals(that.keyPath);
    }

    @Override
    public int hashCode() {
        return keyPath.hashCode();
    }

    @Override
    public String toString() {
        return String.join("/", keyPath);
    }
}
