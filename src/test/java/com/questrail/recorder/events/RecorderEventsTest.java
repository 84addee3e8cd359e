package com.questrail.recorder.events;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.api.Expectation;
import com.questrail.recorder.api.Issue;
import com.questrail.recorder.api.IssueKind;
import com.questrail.recorder.api.TestClock;
import com.questrail.recorder.api.TestInstant;
import com.questrail.recorder.time.ManualTestClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecorderEventsTest {

    @Test
    void engineSuppliedClockIsUsed() {
        TestClock engineClock = () -> 42L;

        assertEquals(TestInstant.ofNanos(42), new RecorderEvents(engineClock).testStarted().instant());
    }

    @Test
    void eventsAreStampedWithTheClock() {
        ManualTestClock clock = new ManualTestClock();
        RecorderEvents events = new RecorderEvents(clock);

        RecorderEvent started = events.runStarted();
        clock.advanceMillis(5);
        RecorderEvent ended = events.runEnded();

        assertEquals(TestInstant.ofNanos(0), started.instant());
        assertEquals(TestInstant.ofNanos(5_000_000), ended.instant());
    }

    @Test
    void everyFactoryMethodReportsItsKind() {
        RecorderEvents events = new RecorderEvents(new ManualTestClock());
        Issue issue = Issue.of(new IssueKind.Unconditional());

        List<RecorderEvent> all = List.of(
                events.runStarted(),
                events.planStepStarted("step"),
                events.testStarted(),
                events.testCaseStarted(),
                events.expectationChecked(Expectation.failed("x == 1")),
                events.issueRecorded(issue),
                events.testCaseEnded(),
                events.testSkipped(Comment.of("why")),
                events.testBypassed(null),
                events.testEnded(),
                events.planStepEnded("step"),
                events.runEnded());

        assertEquals(List.of(RecorderEvent.Kind.values()), all.stream().map(RecorderEvent::kind).toList());
    }

    @Test
    void systemFactoryUsesMonotonicTime() {
        RecorderEvent first = RecorderEvents.system().testStarted();
        RecorderEvent second = RecorderEvents.system().testEnded();

        assertTrue(first.instant().compareTo(second.instant()) <= 0);
    }
}
