package com.questrail.recorder.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A failure, or an expected (known) failure, recorded against a test.
 */
public final class Issue
{
    private final IssueKind kind;
    private final boolean known;
    private final List<Comment> comments;
    private final SourceLocation sourceLocation;

    public Issue(IssueKind kind, boolean known, List<Comment> comments, SourceLocation sourceLocation) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.known = known;
        this.comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
        this.sourceLocation = sourceLocation;
    }

    /**
     * An unexpected issue with no comments and no source location.
     */
    public static Issue of(IssueKind kind) {
        return new Issue(kind, false, List.of(), null);
    }

    public IssueKind kind() {
        return kind;
    }

    public boolean isKnown() {
        return known;
    }

    public List<Comment> comments() {
        return comments;
    }

    public Optional<SourceLocation> sourceLocation() {
        return Optional.ofNullable(sourceLocation);
    }

    /**
     * Returns the difference description of a failed expectation, if any.
     */
    public Optional<String> differenceDescription() {
        if (kind instanceof IssueKind.ExpectationFailed failed) {
            return failed.expectation().differenceDescription();
        }
        return Optional.empty();
    }

    public Issue asKnown() {
        return new Issue(kind, true, comments, sourceLocation);
    }

    public Issue withComments(Comment... comments) {
        return new Issue(kind, known, List.of(comments), sourceLocation);
    }

    public Issue at(SourceLocation sourceLocation) {
        return new Issue(kind, known, comments, Objects.requireNonNull(sourceLocation, "sourceLocation"));
    }

    @Override
    public String toString() {
        return (known ? "known " : "") + kind;
    }
}
