package com.questrail.recorder.events;

import com.questrail.recorder.api.TestInstant;

/**
 * TestCaseEvent
 * -----------------------------------------------------------------------------
 * Boundaries of one invocation of a test function. The test case itself
 * travels in the accompanying {@code EventContext}.
 */
public sealed interface TestCaseEvent extends RecorderEvent
        permits TestCaseEvent.TestCaseStarted, TestCaseEvent.TestCaseEnded
{
    final class TestCaseStarted extends RecorderEvent.Base implements TestCaseEvent {
        public TestCaseStarted(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_CASE_STARTED;
        }
    }

    final class TestCaseEnded extends RecorderEvent.Base implements TestCaseEvent {
        public TestCaseEnded(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_CASE_ENDED;
        }
    }
}
