package com.questrail.recorder.events;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.api.Expectation;
import com.questrail.recorder.api.Issue;
import com.questrail.recorder.api.TestClock;
import com.questrail.recorder.internal.time.SystemTestClock;

import java.util.Objects;

/**
 * Creates events stamped with the current instant of a {@link TestClock}.
 *
 * <p>
 * Engines that do not track instants themselves post events through this
 * factory. {@link #system()} uses {@link SystemTestClock}.
 * </p>
 */
public final class RecorderEvents
{
    private static final RecorderEvents SYSTEM = new RecorderEvents(SystemTestClock.INSTANCE);

    private final TestClock clock;

    public RecorderEvents(TestClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static RecorderEvents system() {
        return SYSTEM;
    }

    public RunEvent.RunStarted runStarted() {
        return new RunEvent.RunStarted(clock.now());
    }

    public RunEvent.RunEnded runEnded() {
        return new RunEvent.RunEnded(clock.now());
    }

    public PlanStepEvent.PlanStepStarted planStepStarted(String stepName) {
        return new PlanStepEvent.PlanStepStarted(clock.now(), stepName);
    }

    public PlanStepEvent.PlanStepEnded planStepEnded(String stepName) {
        return new PlanStepEvent.PlanStepEnded(clock.now(), stepName);
    }

    public TestLifecycleEvent.TestStarted testStarted() {
        return new TestLifecycleEvent.TestStarted(clock.now());
    }

    public TestLifecycleEvent.TestEnded testEnded() {
        return new TestLifecycleEvent.TestEnded(clock.now());
    }

    public TestLifecycleEvent.TestSkipped testSkipped(Comment reason) {
        return new TestLifecycleEvent.TestSkipped(clock.now(), reason);
    }

    public TestLifecycleEvent.TestBypassed testBypassed(Comment reason) {
        return new TestLifecycleEvent.TestBypassed(clock.now(), reason);
    }

    public TestCaseEvent.TestCaseStarted testCaseStarted() {
        return new TestCaseEvent.TestCaseStarted(clock.now());
    }

    public TestCaseEvent.TestCaseEnded testCaseEnded() {
        return new TestCaseEvent.TestCaseEnded(clock.now());
    }

    public IssueEvent.ExpectationChecked expectationChecked(Expectation expectation) {
        return new IssueEvent.ExpectationChecked(clock.now(), expectation);
    }

    public IssueEvent.IssueRecorded issueRecorded(Issue issue) {
        return new IssueEvent.IssueRecorded(clock.now(), issue);
    }
}
