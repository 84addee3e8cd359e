package com.questrail.recorder.internal.state;

import com.questrail.recorder.api.TestId;
import com.questrail.recorder.api.TestInstant;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecorderContextTest
 * -----------------------------------------------------------------------------
 * Validates counters, subtree aggregation and locking of the run context.
 */
class RecorderContextTest {

    private static final TestInstant T0 = TestInstant.ofNanos(0);

    private final TestId suite = TestId.of("Module", "ParserTests");
    private final TestId nested = suite.child("Edge");
    private final TestId a = suite.child("a()");
    private final TestId b = nested.child("b()");
    private final TestId sibling = TestId.of("Module", "ParserTestsExtra", "c()");

    @Test
    void subtreeSumsDescendantsOnly() {
        RecorderContext context = new RecorderContext();
        for (TestId id : List.of(suite, nested, a, b, sibling)) {
            context.beginEntry(id, T0);
        }
        context.incrementIssue(Optional.of(a), false, T0);
        context.incrementIssue(Optional.of(b), false, T0);
        context.incrementIssue(Optional.of(b), true, T0);
        context.incrementIssue(Optional.of(sibling), false, T0);

        assertEquals(new IssueCounts(2, 1), context.readSubtree(suite).issues());
        assertEquals(new IssueCounts(1, 1), context.readSubtree(nested).issues());
        assertEquals(new IssueCounts(1, 0), context.readSubtree(a).issues());
        assertEquals(new IssueCounts(3, 1), context.readAll().issues());
    }

    @Test
    void subtreeStopsAtIdsSortingBetweenSiblings() {
        RecorderContext context = new RecorderContext();
        TestId prefixNamed = TestId.of("Module", "ParserTests!");
        TestId deep = a.child("case").child("1");
        for (TestId id : List.of(prefixNamed, deep, sibling, b, a)) {
            context.incrementIssue(Optional.of(id), false, T0);
        }

        assertEquals(new IssueCounts(3, 0), context.readSubtree(suite).issues());
        assertEquals(new IssueCounts(2, 0), context.readSubtree(a).issues());
        assertEquals(new IssueCounts(1, 0), context.readSubtree(prefixNamed).issues());
        assertEquals(Optional.empty(), context.readSubtree(suite).startInstant());
    }

    @Test
    void keyPathOrderPutsDescendantsDirectlyAfterTheirRoot() {
        assertTrue(RecorderContext.KEY_PATH_ORDER.compare(suite, a) < 0);
        assertTrue(RecorderContext.KEY_PATH_ORDER.compare(b, a) < 0);
        assertTrue(RecorderContext.KEY_PATH_ORDER.compare(b, sibling) < 0);
        assertEquals(0, RecorderContext.KEY_PATH_ORDER.compare(a, suite.child("a()")));
    }

    @Test
    void endingManyTestsStaysFast() {
        RecorderContext context = new RecorderContext();
        int tests = 40_000;
        context.beginEntry(suite, T0);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            for (int i = 0; i < tests; i++) {
                TestId id = suite.child("t" + i + "()");
                context.beginEntry(id, T0);
                context.incrementIssue(Optional.of(id), i % 2 == 0, T0);
                assertEquals(1, context.readSubtree(id).issues().issueCount()
                        + context.readSubtree(id).issues().knownIssueCount());
            }
        });

        assertEquals(new IssueCounts(tests / 2, tests / 2), context.readSubtree(suite).issues());
    }

    @Test
    void missingEntriesCountAsZero() {
        RecorderContext context = new RecorderContext();

        SubtreeSnapshot snapshot = context.readSubtree(suite);

        assertEquals(IssueCounts.NONE, snapshot.issues());
        assertTrue(snapshot.startInstant().isEmpty());
    }

    @Test
    void beginEntryKeepsTheFirstStart() {
        RecorderContext context = new RecorderContext();
        context.beginEntry(a, TestInstant.ofNanos(10));
        context.beginEntry(a, TestInstant.ofNanos(99));

        assertEquals(TestInstant.ofNanos(10), context.readSubtree(a).startInstant().orElseThrow());
    }

    @Test
    void issuesWithoutATestAreNotCounted() {
        RecorderContext context = new RecorderContext();
        context.incrementIssue(Optional.empty(), false, T0);

        assertEquals(IssueCounts.NONE, context.readAll().issues());
    }

    @Test
    void issueForUnstartedTestCreatesEntry() {
        RecorderContext context = new RecorderContext();
        context.incrementIssue(Optional.of(a), true, TestInstant.ofNanos(7));

        SubtreeSnapshot snapshot = context.readSubtree(a);
        assertEquals(new IssueCounts(0, 1), snapshot.issues());
        assertEquals(TestInstant.ofNanos(7), snapshot.startInstant().orElseThrow());
    }

    @Test
    void runCountsSeparateSuitesFromTests() {
        RecorderContext context = new RecorderContext();
        context.recordRunStart(TestInstant.ofNanos(3));
        context.incrementRunCount(true);
        context.incrementRunCount(false);
        context.incrementRunCount(false);

        RunSnapshot snapshot = context.readAll();
        assertEquals(2, snapshot.testCount());
        assertEquals(1, snapshot.suiteCount());
        assertEquals(TestInstant.ofNanos(3), snapshot.runStartInstant().orElseThrow());
    }

    @Test
    void snapshotsDoNotChangeAfterLaterUpdates() {
        RecorderContext context = new RecorderContext();
        context.beginEntry(a, T0);
        SubtreeSnapshot before = context.readSubtree(a);

        context.incrementIssue(Optional.of(a), false, T0);

        assertEquals(IssueCounts.NONE, before.issues());
        assertEquals(new IssueCounts(1, 0), context.readSubtree(a).issues());
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        RecorderContext context = new RecorderContext();
        int threads = 8;
        int issuesPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                TestId id = suite.child("test" + t + "()");
                futures.add(executor.submit(() -> {
                    start.await();
                    context.beginEntry(id, T0);
                    context.incrementRunCount(false);
                    for (int i = 0; i < issuesPerThread; i++) {
                        context.incrementIssue(Optional.of(id), i % 2 == 0, T0);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        RunSnapshot snapshot = context.readAll();
        assertEquals(threads, snapshot.testCount());
        assertEquals(threads * issuesPerThread / 2, snapshot.issues().issueCount());
        assertEquals(threads * issuesPerThread / 2, snapshot.issues().knownIssueCount());
        assertEquals(snapshot.issues(), context.readSubtree(suite).issues());
    }
}
