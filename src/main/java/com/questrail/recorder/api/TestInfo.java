package com.questrail.recorder.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TestInfo
 * -----------------------------------------------------------------------------
 * Read-only description of a test or suite as known to the test engine.
 *
 * <p>
 * The recorder never interprets tests beyond what it needs for presentation:
 * identity, name, display name, whether the test is a suite, its tags, its
 * comments and, for parameterized tests, its parameter list.
 * </p>
 *
 * <p>
 * {@link #parameters()} is empty for suites and for test functions that are
 * not parameterized; it is present (possibly with zero elements) otherwise.
 * </p>
 */
public final class TestInfo
{
    private final TestId id;
    private final String name;
    private final String displayName;
    private final boolean suite;
    private final Set<Tag> tags;
    private final List<Comment> comments;
    private final List<ParameterInfo> parameters;

    private TestInfo(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.name = Objects.requireNonNull(b.name, "name");
        this.displayName = b.displayName;
        this.suite = b.suite;
        this.tags = Set.copyOf(b.tags);
        this.comments = List.copyOf(b.comments);
        this.parameters = b.parameters == null ? null : List.copyOf(b.parameters);
    }

    public TestId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Optional<String> displayName() {
        return Optional.ofNullable(displayName);
    }

    public boolean isSuite() {
        return suite;
    }

    public Set<Tag> tags() {
        return tags;
    }

    public List<Comment> comments() {
        return comments;
    }

    public Optional<List<ParameterInfo>> parameters() {
        return Optional.ofNullable(parameters);
    }

    @Override
    public String toString() {
        return "TestInfo[" + id + "]";
    }

    /**
     * Starts a builder for a test function.
     */
    public static Builder test(TestId id, String name) {
        return new Builder(id, name, false);
    }

    /**
     * Starts a builder for a suite.
     */
    public static Builder suite(TestId id, String name) {
        return new Builder(id, name, true);
    }

    public static final class Builder {
        private final TestId id;
        private final String name;
        private final boolean suite;
        private String displayName;
        private final Set<Tag> tags = new LinkedHashSet<>();
        private final List<Comment> comments = new ArrayList<>();
        private List<ParameterInfo> parameters;

        private Builder(TestId id, String name, boolean suite) {
            this.id = id;
            this.name = name;
            this.suite = suite;
        }

        public Builder withDisplayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder withTags(Tag... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Builder withComments(Comment... comments) {
            this.comments.addAll(List.of(comments));
            return this;
        }

        public Builder withParameters(ParameterInfo... parameters) {
            this.parameters = List.of(parameters);
            return this;
        }

        public TestInfo build() {
            return new TestInfo(this);
        }
    }
}
