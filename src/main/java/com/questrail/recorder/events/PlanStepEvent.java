package com.questrail.recorder.events;

import com.questrail.recorder.api.TestInstant;

import java.util.Objects;

/**
 * PlanStepEvent
 * -----------------------------------------------------------------------------
 * Boundaries of an intermediate step of the engine's execution plan.
 *
 * These are engine bookkeeping and are not shown in human-readable output.
 */
public sealed interface PlanStepEvent extends RecorderEvent
        permits PlanStepEvent.PlanStepStarted, PlanStepEvent.PlanStepEnded
{
    /**
     * Name of the plan step, for diagnostics.
     */
    String stepName();

    final class PlanStepStarted extends RecorderEvent.Base implements PlanStepEvent {
        private final String stepName;

        public PlanStepStarted(TestInstant instant, String stepName) {
            super(instant);
            this.stepName = Objects.requireNonNull(stepName, "stepName");
        }

        @Override
        public String stepName() {
            return stepName;
        }

        @Override
        public Kind kind() {
            return Kind.PLAN_STEP_STARTED;
        }
    }

    final class PlanStepEnded extends RecorderEvent.Base implements PlanStepEvent {
        private final String stepName;

        public PlanStepEnded(TestInstant instant, String stepName) {
            super(instant);
            this.stepName = Objects.requireNonNull(stepName, "stepName");
        }

        @Override
        public String stepName() {
            return stepName;
        }

        @Override
        public Kind kind() {
            return Kind.PLAN_STEP_ENDED;
        }
    }
}
