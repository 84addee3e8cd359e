package com.questrail.recorder.events;

import com.questrail.recorder.api.TestInstant;

/**
 * RunEvent
 * -----------------------------------------------------------------------------
 * Events bracketing a whole test run. They carry no test.
 */
public sealed interface RunEvent extends RecorderEvent
        permits RunEvent.RunStarted, RunEvent.RunEnded
{
    /** The run began; no test has started yet. */
    final class RunStarted extends RecorderEvent.Base implements RunEvent {
        public RunStarted(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.RUN_STARTED;
        }
    }

    /** The run finished; no further events follow. */
    final class RunEnded extends RecorderEvent.Base implements RunEvent {
        public RunEnded(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.RUN_ENDED;
        }
    }
}
