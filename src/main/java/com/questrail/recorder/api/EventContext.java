package com.questrail.recorder.api;

import java.util.Optional;

/**
 * Engine-owned context accompanying an event: the test and test case that
 * were running when it was posted.
 *
 * <p>
 * Run-level events carry neither. Test-level events carry a test. Events
 * posted while a particular invocation runs also carry its test case.
 * </p>
 */
public final class EventContext
{
    private static final EventContext EMPTY = new EventContext(null, null);

    private final TestInfo test;
    private final TestCaseInfo testCase;

    private EventContext(TestInfo test, TestCaseInfo testCase) {
        this.test = test;
        this.testCase = testCase;
    }

    public static EventContext empty() {
        return EMPTY;
    }

    public static EventContext of(TestInfo test) {
        return new EventContext(test, null);
    }

    public static EventContext of(TestInfo test, TestCaseInfo testCase) {
        return new EventContext(test, testCase);
    }

    public Optional<TestInfo> test() {
        return Optional.ofNullable(test);
    }

    public Optional<TestCaseInfo> testCase() {
        return Optional.ofNullable(testCase);
    }
}
