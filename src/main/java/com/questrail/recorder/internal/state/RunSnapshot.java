package com.questrail.recorder.internal.state;

import com.questrail.recorder.api.TestInstant;

import java.util.Optional;

/**
 * Immutable view of the whole run.
 *
 * @param runStartInstant when the run started, empty if never reported
 * @param testCount       tests started or skipped, excluding suites
 * @param suiteCount      suites started or skipped
 * @param issues          issue counters summed over every test
 */
public record RunSnapshot(Optional<TestInstant> runStartInstant,
                          int testCount,
                          int suiteCount,
                          IssueCounts issues) {}
