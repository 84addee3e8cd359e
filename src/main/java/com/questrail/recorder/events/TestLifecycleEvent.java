package com.questrail.recorder.events;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.api.TestInstant;

import java.util.Optional;

/**
 * TestLifecycleEvent
 * -----------------------------------------------------------------------------
 * Events in the life of a single test or suite. The test itself travels in
 * the accompanying {@code EventContext}.
 *
 * <p>
 * A test is either started (and later ended) or skipped, never both.
 * </p>
 */
public sealed interface TestLifecycleEvent extends RecorderEvent
        permits TestLifecycleEvent.TestStarted,
                TestLifecycleEvent.TestEnded,
                TestLifecycleEvent.TestSkipped,
                TestLifecycleEvent.TestBypassed
{
    /** The test or suite began running. */
    final class TestStarted extends RecorderEvent.Base implements TestLifecycleEvent {
        public TestStarted(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_STARTED;
        }
    }

    /** The test or suite, including everything it contains, finished. */
    final class TestEnded extends RecorderEvent.Base implements TestLifecycleEvent {
        public TestEnded(TestInstant instant) {
            super(instant);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_ENDED;
        }
    }

    /**
     * The test or suite was not run. The optional comment gives the reason.
     */
    final class TestSkipped extends RecorderEvent.Base implements TestLifecycleEvent {
        private final Comment comment;

        public TestSkipped(TestInstant instant, Comment comment) {
            super(instant);
            this.comment = comment;
        }

        public TestSkipped(TestInstant instant) {
            this(instant, null);
        }

        public Optional<Comment> comment() {
            return Optional.ofNullable(comment);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_SKIPPED;
        }
    }

    /**
     * Legacy form of {@link TestSkipped}. Engines that still post it also post
     * {@link TestSkipped} for the same test.
     */
    final class TestBypassed extends RecorderEvent.Base implements TestLifecycleEvent {
        private final Comment comment;

        public TestBypassed(TestInstant instant, Comment comment) {
            super(instant);
            this.comment = comment;
        }

        public Optional<Comment> comment() {
            return Optional.ofNullable(comment);
        }

        @Override
        public Kind kind() {
            return Kind.TEST_BYPASSED;
        }
    }
}
