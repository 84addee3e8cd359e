package com.questrail.recorder.internal.state;

import com.questrail.recorder.api.TestId;
import com.questrail.recorder.api.TestInstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * RecorderContext
 * -----------------------------------------------------------------------------
 * Run-scoped aggregation state of an event recorder.
 *
 * <h2>What this class holds</h2>
 * <ul>
 *   <li>the instant the run started</li>
 *   <li>the number of tests and of suites started or skipped</li>
 *   <li>per-test {@link TestData}, in a flat map keyed by {@link TestId}</li>
 * </ul>
 *
 * The test hierarchy is not materialized. Keys are ordered component by
 * component, shorter paths first, so an id is immediately followed by all of
 * its descendants. A subtree query walks forward from the root until the
 * first id the root does not {@link TestId#contains(TestId) contain}; ids
 * without an entry contribute nothing.
 *
 * <h2>Threading model</h2>
 * Tests run in parallel, so events arrive concurrently. Every operation runs
 * under a single private lock held only for the mutation or the copy itself.
 * Readers receive immutable snapshots and format them outside the lock.
 * No operation performs I/O while holding the lock.
 */
public final class RecorderContext
{
    private static final Logger log = LoggerFactory.getLogger(RecorderContext.class);

    static final Comparator<TestId> KEY_PATH_ORDER = RecorderContext::compareKeyPaths;

    private final Object lock = new Object();

    private TestInstant runStartInstant;
    private int testCount;
    private int suiteCount;
    private final NavigableMap<TestId, TestData> testData = new TreeMap<>(KEY_PATH_ORDER);

    public void recordRunStart(TestInstant instant) {
        Objects.requireNonNull(instant, "instant");
        synchronized (lock) {
            runStartInstant = instant;
        }
    }

    /**
     * Starts tracking {@code id}. A second call for the same id keeps the
     * original entry.
     */
    public void beginEntry(TestId id, TestInstant startInstant) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(startInstant, "startInstant");
        synchronized (lock) {
            testData.putIfAbsent(id, new TestData(startInstant));
        }
    }

    /**
     * Counts a started or skipped test, or suite.
     */
    public void incrementRunCount(boolean isSuite) {
        synchronized (lock) {
            if (isSuite) {
                suiteCount++;
            } else {
                testCount++;
            }
        }
    }

    /**
     * Counts an issue against {@code id}. Issues recorded outside any test
     * ({@code id} empty) are not counted.
     *
     * @param instant when the issue was recorded; becomes the start instant
     *                if {@code id} was never started
     */
    public void incrementIssue(Optional<TestId> id, boolean known, TestInstant instant) {
        if (id.isEmpty()) {
            return;
        }
        TestId key = id.get();
        boolean created = false;
        synchronized (lock) {
            TestData data = testData.get(key);
            if (data == null) {
                data = new TestData(instant);
                testData.put(key, data);
                created = true;
            }
            data.recordIssue(known);
        }
        if (created) {
            log.debug("Issue recorded for {} before it started; tracking it from now", key);
        }
    }

    /**
     * Snapshot of {@code id} and its descendants.
     */
    public SubtreeSnapshot readSubtree(TestId id) {
        Objects.requireNonNull(id, "id");
        synchronized (lock) {
            TestData root = testData.get(id);
            IssueCounts issues = IssueCounts.NONE;
            for (Map.Entry<TestId, TestData> entry : testData.tailMap(id, true).entrySet()) {
                if (!id.contains(entry.getKey())) {
                    break;
                }
                TestData data = entry.getValue();
                issues = issues.plus(data.issueCount(), data.knownIssueCount());
            }
            return new SubtreeSnapshot(id,
                    Optional.ofNullable(root).map(TestData::startInstant),
                    issues);
        }
    }

    /**
     * Snapshot of the whole run.
     */
    public RunSnapshot readAll() {
        synchronized (lock) {
            IssueCounts issues = IssueCounts.NONE;
            for (TestData data : testData.values()) {
                issues = issues.plus(data.issueCount(), data.knownIssueCount());
            }
            return new RunSnapshot(Optional.ofNullable(runStartInstant), testCount, suiteCount, issues);
        }
    }

    private static int compareKeyPaths(TestId a, TestId b) {
        List<String> left = a.keyPath();
        List<String> right = b.keyPath();
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int c = left.get(i).compareTo(right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
