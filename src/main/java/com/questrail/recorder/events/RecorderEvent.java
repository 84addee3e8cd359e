package com.questrail.recorder.events;

import com.questrail.recorder.api.TestInstant;

import java.util.Objects;

/**
 * RecorderEvent
 * -----------------------------------------------------------------------------
 * Root of the closed family of lifecycle events posted by the test engine.
 *
 * <h2>Role in the architecture</h2>
 * The engine posts one event per lifecycle step; the recorder consumes each
 * event exactly once and never feeds anything back. Events are the only way
 * information about test progress enters the recorder.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable</li>
 *   <li>Events carry only kind-specific payload; the running test and test
 *       case travel separately in an {@code EventContext}</li>
 *   <li>Every event reports its {@link Kind}, so consumers can dispatch with
 *       an exhaustive {@code switch}. Adding a kind breaks every consumer
 *       until it decides what to do with it.</li>
 * </ul>
 */
public sealed interface RecorderEvent
        permits RunEvent, PlanStepEvent, TestLifecycleEvent, TestCaseEvent, IssueEvent
{
    /**
     * Every kind of event the engine can post.
     */
    enum Kind {
        RUN_STARTED,
        PLAN_STEP_STARTED,
        TEST_STARTED,
        TEST_CASE_STARTED,
        EXPECTATION_CHECKED,
        ISSUE_RECORDED,
        TEST_CASE_ENDED,
        TEST_SKIPPED,
        /** Legacy skip notification, superseded by {@link #TEST_SKIPPED}. */
        TEST_BYPASSED,
        TEST_ENDED,
        PLAN_STEP_ENDED,
        RUN_ENDED
    }

    /**
     * Monotonic time at which the event occurred.
     */
    TestInstant instant();

    Kind kind();

    /**
     * Convenience base class for events.
     */
    abstract class Base {
        private final TestInstant instant;

        protected Base(TestInstant instant) {
            this.instant = Objects.requireNonNull(instant, "instant");
        }

        public TestInstant instant() {
            return instant;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + instant.nanos();
        }
    }
}
