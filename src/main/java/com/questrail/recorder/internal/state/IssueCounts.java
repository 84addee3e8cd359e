package com.questrail.recorder.internal.state;

/**
 * Summed issue counters of a set of tests.
 *
 * @param issueCount      unexpected issues
 * @param knownIssueCount known issues
 */
public record IssueCounts(int issueCount, int knownIssueCount) {
    public static final IssueCounts NONE = new IssueCounts(0, 0);

    public IssueCounts {
        if (issueCount < 0 || knownIssueCount < 0) {
            throw new IllegalArgumentException("issue counts must be non-negative");
        }
    }

    public boolean hasIssues() {
        return issueCount > 0;
    }

    public boolean hasKnownIssues() {
        return knownIssueCount > 0;
    }

    IssueCounts plus(int issues, int knownIssues) {
        return new IssueCounts(issueCount + issues, knownIssueCount + knownIssues);
    }
}
