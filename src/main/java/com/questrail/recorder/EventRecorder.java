package com.questrail.recorder;

import com.questrail.recorder.api.Comment;
import com.questrail.recorder.api.EventContext;
import com.questrail.recorder.api.Issue;
import com.questrail.recorder.api.ParameterInfo;
import com.questrail.recorder.api.TestCaseInfo;
import com.questrail.recorder.api.TestInfo;
import com.questrail.recorder.api.TestInstant;
import com.questrail.recorder.config.EnvironmentInfo;
import com.questrail.recorder.config.RecorderOptions;
import com.questrail.recorder.events.IssueEvent;
import com.questrail.recorder.events.RecorderEvent;
import com.questrail.recorder.events.TestLifecycleEvent;
import com.questrail.recorder.format.ArgumentFormatter;
import com.questrail.recorder.format.CommentFormatter;
import com.questrail.recorder.format.Counting;
import com.questrail.recorder.format.DurationFormatter;
import com.questrail.recorder.format.Symbol;
import com.questrail.recorder.format.TagColorResolver;
import com.questrail.recorder.internal.state.IssueCounts;
import com.questrail.recorder.internal.state.RecorderContext;
import com.questrail.recorder.internal.state.RunSnapshot;
import com.questrail.recorder.internal.state.SubtreeSnapshot;
import com.questrail.recorder.sink.RecorderSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * EventRecorder
 * =============================================================================
 * Turns test lifecycle events into human-readable, optionally colored text.
 *
 * <h2>Role in the architecture</h2>
 * The test engine posts every event to {@link #record(RecorderEvent, EventContext)}
 * together with the test and test case that were running. The recorder:
 * <ol>
 *   <li>updates its run-scoped {@link RecorderContext} (test, suite and issue
 *       counters)</li>
 *   <li>renders one newline-terminated piece of text from the event and the
 *       aggregated state</li>
 *   <li>hands the text to its {@link RecorderSink}</li>
 * </ol>
 * It is purely a consumer and never influences test execution. The output
 * format is meant for people and may change at any time.
 *
 * <h2>Suppressed events</h2>
 * Plan step boundaries, expectation checks, test case ends and the legacy
 * bypass notification produce no output and leave the context untouched.
 *
 * <h2>Threading model</h2>
 * Both {@link #render} and {@link #record} may be called concurrently from any
 * number of threads. Context mutations and snapshots are short and locked;
 * formatting and sink writes happen outside the lock, so output of
 * concurrent events appears in whatever order the sink receives it.
 */
public final class EventRecorder
{
    private static final Logger log = LoggerFactory.getLogger(EventRecorder.class);

    static final String UNKNOWN_TEST_NAME = "\u00ABunknown\u00BB";

    private final RecorderOptions options;
    private final RecorderSink sink;
    private final TagColorResolver tagColors;
    private final RecorderContext context = new RecorderContext();

    public EventRecorder(RecorderOptions options, RecorderSink sink) {
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.tagColors = new TagColorResolver(options);
    }

    public RecorderOptions options() {
        return options;
    }

    /**
     * Renders {@code event} and writes the result to the sink.
     *
     * @return {@code true} if anything was written
     */
    public boolean record(RecorderEvent event, EventContext eventContext) {
        Optional<String> output = render(event, eventContext);
        output.ifPresent(sink::write);
        return output.isPresent();
    }

    /**
     * Updates the aggregated state for {@code event} and renders it.
     *
     * @return the text for {@code event}, or empty if the event is not shown
     */
    public Optional<String> render(RecorderEvent event, EventContext eventContext) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(eventContext, "eventContext");

        return switch (event.kind()) {
            case RUN_STARTED -> Optional.of(onRunStarted(event.instant()));
            case TEST_STARTED -> onTestStarted(event.instant(), eventContext);
            case TEST_ENDED -> onTestEnded(event.instant(), eventContext);
            case TEST_SKIPPED -> onTestSkipped((TestLifecycleEvent.TestSkipped) event, eventContext);
            case ISSUE_RECORDED -> Optional.of(onIssueRecorded((IssueEvent.IssueRecorded) event, eventContext));
            case TEST_CASE_STARTED -> onTestCaseStarted(eventContext);
            case RUN_ENDED -> Optional.of(onRunEnded(event.instant()));
            case PLAN_STEP_STARTED, PLAN_STEP_ENDED, EXPECTATION_CHECKED, TEST_CASE_ENDED, TEST_BYPASSED -> {
                log.trace("Suppressed {}", event);
                yield Optional.empty();
            }
        };
    }

    /**
     * Formats an advisory message with the warning symbol. The caller decides
     * where to show it.
     */
    public static String warning(String message, RecorderOptions options) {
        return Symbol.WARNING.render(options) + " " + message;
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private String onRunStarted(TestInstant instant) {
        context.recordRunStart(instant);

        EnvironmentInfo environment = options.environment();
        List<Comment> comments = List.of(
                Comment.of("Java Version: " + environment.runtimeVersion()),
                Comment.of("Testing Library Version: " + environment.libraryVersion()),
                Comment.of("OS Version: " + environment.osVersion())
        );
        String symbol = Symbol.DEFAULT.render(options);
        return symbol + " Test run started.\n"
                + CommentFormatter.format(comments, options).map(c -> c + "\n").orElse("");
    }

    private Optional<String> onTestStarted(TestInstant instant, EventContext eventContext) {
        Optional<TestInfo> test = requireTest(RecorderEvent.Kind.TEST_STARTED, eventContext);
        if (test.isEmpty()) {
            return Optional.empty();
        }
        TestInfo info = test.get();
        context.beginEntry(info.id(), instant);
        context.incrementRunCount(info.isSuite());

        return Optional.of(Symbol.DEFAULT.render(options) + " Test " + testName(test) + " started.\n");
    }

    private Optional<String> onTestEnded(TestInstant instant, EventContext eventContext) {
        Optional<TestInfo> test = requireTest(RecorderEvent.Kind.TEST_ENDED, eventContext);
        if (test.isEmpty()) {
            return Optional.empty();
        }
        TestInfo info = test.get();
        SubtreeSnapshot snapshot = context.readSubtree(info.id());
        if (snapshot.startInstant().isEmpty()) {
            log.debug("Test {} ended without having started", info.id());
        }

        IssueCounts issues = snapshot.issues();
        String duration = DurationFormatter.describe(snapshot.startInstant().orElse(instant), instant);
        String suffix = Counting.issueSuffix(issues.issueCount(), issues.knownIssueCount());
        String name = testName(test);

        if (issues.hasIssues()) {
            String comments = CommentFormatter.format(info.comments(), options)
                    .map(c -> c + "\n")
                    .orElse("");
            return Optional.of(Symbol.FAIL.render(options)
                    + " Test " + name + " failed after " + duration + suffix + ".\n" + comments);
        }
        return Optional.of(Symbol.pass(issues.hasKnownIssues()).render(options)
                + " Test " + name + " passed after " + duration + suffix + ".\n");
    }

    private Optional<String> onTestSkipped(TestLifecycleEvent.TestSkipped event, EventContext eventContext) {
        Optional<TestInfo> test = requireTest(RecorderEvent.Kind.TEST_SKIPPED, eventContext);
        if (test.isEmpty()) {
            return Optional.empty();
        }
        context.incrementRunCount(test.get().isSuite());

        String symbol = Symbol.SKIP.render(options);
        String name = testName(test);
        return Optional.of(event.comment()
                .map(comment -> symbol + " Test " + name + " skipped: \"" + comment.rawValue() + "\"\n")
                .orElse(symbol + " Test " + name + " skipped.\n"));
    }

    private String onIssueRecorded(IssueEvent.IssueRecorded event, EventContext eventContext) {
        Issue issue = event.issue();
        Optional<TestInfo> test = eventContext.test();
        context.incrementIssue(test.map(TestInfo::id), issue.isKnown(), event.instant());

        Optional<List<ParameterInfo>> parameters = test.flatMap(TestInfo::parameters);
        int parameterCount = parameters.map(List::size).orElse(0);

        StringBuilder out = new StringBuilder();
        if (issue.isKnown()) {
            out.append(Symbol.pass(true).render(options)).append(" Test ").append(testName(test))
                    .append(" recorded a known issue");
        } else {
            out.append(Symbol.FAIL.render(options)).append(" Test ").append(testName(test))
                    .append(" recorded an issue");
        }
        if (parameterCount > 0) {
            String labeledArguments = eventContext.testCase()
                    .map(testCase -> ArgumentFormatter.labeledArguments(testCase, parameters.get()))
                    .orElse("");
            out.append(" with ").append(Counting.of(parameterCount, "argument"))
                    .append(' ').append(labeledArguments);
        }
        issue.sourceLocation().ifPresent(location -> out.append(" at ").append(location));
        out.append(": ").append(issue.kind());

        issue.differenceDescription().ifPresent(difference -> out.append('\n')
                .append(Symbol.DIFFERENCE.render(options)).append(' ').append(difference));
        CommentFormatter.format(issue.comments(), options)
                .ifPresent(comments -> out.append('\n').append(comments));

        return out.append('\n').toString();
    }

    private Optional<String> onTestCaseStarted(EventContext eventContext) {
        Optional<TestCaseInfo> testCase = eventContext.testCase().filter(TestCaseInfo::isParameterized);
        Optional<List<ParameterInfo>> parameters = eventContext.test().flatMap(TestInfo::parameters);
        if (testCase.isEmpty() || parameters.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Symbol.DEFAULT.render(options)
                + " Passing " + Counting.of(parameters.get().size(), "argument")
                + " " + ArgumentFormatter.labeledArguments(testCase.get(), parameters.get())
                + " to " + testName(eventContext.test()) + "\n");
    }

    private String onRunEnded(TestInstant instant) {
        RunSnapshot snapshot = context.readAll();
        IssueCounts issues = snapshot.issues();
        String duration = DurationFormatter.describe(snapshot.runStartInstant().orElse(instant), instant);
        String suffix = Counting.issueSuffix(issues.issueCount(), issues.knownIssueCount());
        String tests = Counting.of(snapshot.testCount(), "test");

        if (issues.hasIssues()) {
            return Symbol.FAIL.render(options)
                    + " Test run with " + tests + " failed after " + duration + suffix + ".\n";
        }
        return Symbol.pass(issues.hasKnownIssues()).render(options)
                + " Test run with " + tests + " passed after " + duration + suffix + ".\n";
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * Quoted display name, else the test's name, else a placeholder; prefixed
     * with colored tag dots when ANSI escape codes are enabled.
     */
    String testName(Optional<TestInfo> test) {
        if (test.isEmpty()) {
            return UNKNOWN_TEST_NAME;
        }
        TestInfo info = test.get();
        String name = info.displayName()
                .map(displayName -> "\"" + displayName + "\"")
                .orElse(info.name());
        if (options.useAnsiEscapeCodes() && !info.tags().isEmpty()) {
            String dots = tagColors.colorDots(info.tags());
            if (!dots.isEmpty()) {
                return dots + " " + name;
            }
        }
        return name;
    }

    private static Optional<TestInfo> requireTest(RecorderEvent.Kind kind, EventContext eventContext) {
        Optional<TestInfo> test = eventContext.test();
        if (test.isEmpty()) {
            log.debug("{} posted without a test; nothing to record", kind);
        }
        return test;
    }
}
