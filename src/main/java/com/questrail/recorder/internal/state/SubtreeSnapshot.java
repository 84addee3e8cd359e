package com.questrail.recorder.internal.state;

import com.questrail.recorder.api.TestId;
import com.questrail.recorder.api.TestInstant;

import java.util.Optional;

/**
 * Immutable view of one test or suite and everything it contains.
 *
 * @param id           root of the subtree
 * @param startInstant start of the root test, empty if it was never started
 * @param issues       issue counters summed over the subtree
 */
public record SubtreeSnapshot(TestId id, Optional<TestInstant> startInstant, IssueCounts issues) {}
