package com.questrail.recorder.events;

import com.questrail.recorder.api.Expectation;
import com.questrail.recorder.api.Issue;
import com.questrail.recorder.api.TestInstant;

import java.util.Objects;

/**
 * IssueEvent
 * -----------------------------------------------------------------------------
 * Events raised while a test body runs.
 *
 * <p>
 * {@link ExpectationChecked} fires for every evaluated expectation, passing or
 * not; a failing expectation additionally produces an {@link IssueRecorded}.
 * </p>
 */
public sealed interface IssueEvent extends RecorderEvent
        permits IssueEvent.ExpectationChecked, IssueEvent.IssueRecorded
{
    final class ExpectationChecked extends RecorderEvent.Base implements IssueEvent {
        private final Expectation expectation;

        public ExpectationChecked(TestInstant instant, Expectation expectation) {
            super(instant);
            this.expectation = Objects.requireNonNull(expectation, "expectation");
        }

        public Expectation expectation() {
            return expectation;
        }

        @Override
        public Kind kind() {
            return Kind.EXPECTATION_CHECKED;
        }
    }

    final class IssueRecorded extends RecorderEvent.Base implements IssueEvent {
        private final Issue issue;

        public IssueRecorded(TestInstant instant, Issue issue) {
            super(instant);
            this.issue = Objects.requireNonNull(issue, "issue");
        }

        public Issue issue() {
            return issue;
        }

        @Override
        public Kind kind() {
            return Kind.ISSUE_RECORDED;
        }
    }
}
