package com.questrail.recorder.api;

import java.time.Duration;
import java.util.Objects;

/**
 * IssueKind
 * -----------------------------------------------------------------------------
 * What went wrong when an {@link Issue} was recorded.
 *
 * <p>
 * The family is closed. Each kind renders itself through {@link #toString()},
 * which is the description shown after "recorded an issue".
 * </p>
 */
public sealed interface IssueKind
        permits IssueKind.Unconditional,
                IssueKind.ExpectationFailed,
                IssueKind.ErrorCaught,
                IssueKind.TimeLimitExceeded,
                IssueKind.KnownIssueNotRecorded,
                IssueKind.ApiMisused,
                IssueKind.SystemFailure
{
    /** An issue recorded explicitly by test code. */
    record Unconditional() implements IssueKind {
        @Override
        public String toString() {
            return "Issue recorded";
        }
    }

    /** An expectation evaluated to false. */
    record ExpectationFailed(Expectation expectation) implements IssueKind {
        public ExpectationFailed {
            Objects.requireNonNull(expectation, "expectation");
            if (expectation.isPassing()) {
                throw new IllegalArgumentException("expectation passed: " + expectation);
            }
        }

        @Override
        public String toString() {
            return "Expectation failed: " + expectation.expandedDescription();
        }
    }

    /** Test code threw an error that was not otherwise handled. */
    record ErrorCaught(Throwable error) implements IssueKind {
        public ErrorCaught {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String toString() {
            return "Caught error: " + error;
        }
    }

    /** The test ran longer than its time limit. */
    record TimeLimitExceeded(Duration timeLimit) implements IssueKind {
        public TimeLimitExceeded {
            Objects.requireNonNull(timeLimit, "timeLimit");
        }

        @Override
        public String toString() {
            return "Time limit was exceeded: " + timeLimit;
        }
    }

    /** A known issue was expected but none occurred. */
    record KnownIssueNotRecorded() implements IssueKind {
        @Override
        public String toString() {
            return "Known issue was not recorded";
        }
    }

    /** The testing API was used incorrectly. */
    record ApiMisused() implements IssueKind {
        @Override
        public String toString() {
            return "An API was misused";
        }
    }

    /** A failure in the test engine itself. */
    record SystemFailure() implements IssueKind {
        @Override
        public String toString() {
            return "A system failure occurred";
        }
    }
}
