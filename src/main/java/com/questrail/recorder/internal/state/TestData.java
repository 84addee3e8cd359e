package com.questrail.recorder.internal.state;

import com.questrail.recorder.api.TestInstant;

import java.util.Objects;

/**
 * Per-test aggregation data.
 *
 * <p>
 * Created on the first observation of a test and never replaced. The issue
 * counters only increase. Instances are owned by {@link RecorderContext} and
 * mutated only under its lock.
 * </p>
 */
final class TestData
{
    private final TestInstant startInstant;
    private int issueCount;
    private int knownIssueCount;

    TestData(TestInstant startInstant) {
        this.startInstant = Objects.requireNonNull(startInstant, "startInstant");
    }

    TestInstant startInstant() {
        return startInstant;
    }

    int issueCount() {
        return issueCount;
    }

    int knownIssueCount() {
        return knownIssueCount;
    }

    void recordIssue(boolean known) {
        if (known) {
            knownIssueCount++;
        } else {
            issueCount++;
        }
    }
}
