package it.berlink.querywatch;

import it.berlink.querywatch.analysis.StatementAnalyzer;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.exception.InvalidScopeException;
import it.berlink.querywatch.log.StatementLog;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.reporter.LiveReporter;
import it.berlink.querywatch.scope.ScopeDelta;
import it.berlink.querywatch.scope.ScopeHandle;
import it.berlink.querywatch.scope.ScopeTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Entry point for live statement monitoring.
 *
 * Wraps scope tracking, analysis and reporting so that monitoring can never
 * fail the observed work: every failure is logged and turns into "no report".
 *
 * <pre>
 * try (MonitoredScope scope = engine.open("rebuild feed")) {
 *     feedService.rebuild();
 * }
 * </pre>
 */
@Slf4j
public class QueryWatchEngine {

    private final ScopeTracker tracker;
    private final StatementAnalyzer analyzer;
    private final LiveReporter reporter;
    private final boolean enabled;

    public QueryWatchEngine(StatementLog statementLog, ThresholdConfig config) {
        this(new ScopeTracker(statementLog), new StatementAnalyzer(config), new LiveReporter(config), true);
    }

    public QueryWatchEngine(ScopeTracker tracker, StatementAnalyzer analyzer, LiveReporter reporter, boolean enabled) {
        this.tracker = tracker;
        this.analyzer = analyzer;
        this.reporter = reporter;
        this.enabled = enabled;
    }

    /**
     * Opens a scope. Never throws: if the statement log cannot be read, a detached
     * handle is returned and closing it produces no report.
     */
    public ScopeHandle begin(String label) {
        try {
            return tracker.begin(label);
        } catch (RuntimeException e) {
            log.warn("Could not open monitoring scope {}: {}", label, e.getMessage());
            return ScopeHandle.detached(label, Instant.now());
        }
    }

    /**
     * Closes a scope, analyzes and reports it.
     *
     * @return the report, or empty if monitoring is disabled or the scope could not be closed
     */
    public Optional<ScopeReport> end(ScopeHandle handle) {
        if (handle == null) {
            return Optional.empty();
        }
        try {
            ScopeDelta delta = tracker.end(handle);
            if (!enabled) {
                return Optional.empty();
            }
            ScopeReport report = analyzer.analyze(delta.label(), delta.records(), delta.elapsedSeconds());
            reporter.report(report);
            return Optional.of(report);
        } catch (InvalidScopeException e) {
            if (e.getReason() == InvalidScopeException.Reason.DETACHED) {
                log.debug("No report for detached scope {}", handle.getLabel());
            } else {
                log.warn("Discarding monitoring scope {}: {}", handle.getLabel(), e.getMessage());
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Statement monitoring failed for scope {}", handle.getLabel(), e);
            return Optional.empty();
        }
    }

    /**
     * Opens a scope to be closed by try-with-resources.
     */
    public MonitoredScope open(String label) {
        return new MonitoredScope(this, begin(label));
    }

    /**
     * Runs {@code block} inside a scope labelled {@code label} and returns its result.
     * Exceptions thrown by the block propagate; monitoring failures do not.
     */
    public <T> T monitor(String label, Callable<T> block) throws Exception {
        try (MonitoredScope ignored = open(label)) {
            return block.call();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public StatementAnalyzer getAnalyzer() {
        return analyzer;
    }
}
