package it.berlink.querywatch;

import it.berlink.querywatch.analysis.StatementAnalyzer;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.log.InMemoryStatementLog;
import it.berlink.querywatch.log.StatementLog;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.reporter.LiveReporter;
import it.berlink.querywatch.scope.ScopeHandle;
import it.berlink.querywatch.scope.ScopeTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryWatchEngineTest {

    private InMemoryStatementLog statementLog;
    private QueryWatchEngine engine;

    @BeforeEach
    void setUp() {
        statementLog = new InMemoryStatementLog();
        engine = new QueryWatchEngine(statementLog, ThresholdConfig.defaults());
    }

    @Test
    void reportsStatementsOfTheScope() {
        ScopeHandle handle = engine.begin("GET /posts");
        for (int i = 0; i < 25; i++) {
            statementLog.append("SELECT * FROM comment WHERE post_id = " + i, 0.002);
        }

        Optional<ScopeReport> report = engine.end(handle);

        assertTrue(report.isPresent());
        assertEquals(25, report.get().getTotalStatementCount());
        assertTrue(report.get().isSuspectedNPlusOne());
        assertFalse(report.get().isSlowStatements());
    }

    @Test
    void endingTwiceGivesNoSecondReport() {
        ScopeHandle handle = engine.begin("twice");
        statementLog.append("SELECT 1", 0.001);

        Optional<ScopeReport> first = engine.end(handle);
        statementLog.append("SELECT 2", 0.001);
        Optional<ScopeReport> second = engine.end(handle);

        assertEquals(1, first.orElseThrow().getTotalStatementCount());
        assertTrue(second.isEmpty());
    }

    @Test
    void resetLogGivesNoReportInsteadOfFailing() {
        statementLog.append("SELECT 1", 0.001);
        ScopeHandle handle = engine.begin("reset");
        statementLog.clear();

        assertTrue(engine.end(handle).isEmpty());
    }

    @Test
    void unreadableLogStillLetsTheWorkRun() throws Exception {
        StatementLog broken = mock(StatementLog.class);
        when(broken.length()).thenThrow(new IllegalStateException("driver gone"));
        QueryWatchEngine brokenEngine = new QueryWatchEngine(broken, ThresholdConfig.defaults());

        ScopeHandle handle = brokenEngine.begin("GET /");
        assertTrue(handle.isDetached());
        assertTrue(brokenEngine.end(handle).isEmpty());
        assertEquals("done", brokenEngine.monitor("block", () -> "done"));
    }

    @Test
    void reporterFailureIsSwallowed() {
        LiveReporter reporter = mock(LiveReporter.class);
        when(reporter.report(any())).thenThrow(new IllegalStateException("appender broken"));
        QueryWatchEngine failing = new QueryWatchEngine(new ScopeTracker(statementLog),
            new StatementAnalyzer(ThresholdConfig.defaults()), reporter, true);

        ScopeHandle handle = failing.begin("GET /");
        statementLog.append("SELECT 1", 0.001);

        assertTrue(failing.end(handle).isEmpty());
    }

    @Test
    void disabledEngineProducesNoReports() {
        LiveReporter reporter = mock(LiveReporter.class);
        QueryWatchEngine disabled = new QueryWatchEngine(new ScopeTracker(statementLog),
            new StatementAnalyzer(ThresholdConfig.defaults()), reporter, false);

        ScopeHandle handle = disabled.begin("GET /");
        statementLog.append("SELECT 1", 0.001);

        assertTrue(disabled.end(handle).isEmpty());
        verifyNoInteractions(reporter);
    }

    @Test
    void monitoredScopeReportsOnClose() {
        MonitoredScope scope = engine.open("load feed");
        try (scope) {
            statementLog.append("SELECT * FROM post", 0.003);
            assertTrue(scope.getReport().isEmpty());
        }
        scope.close();

        assertEquals(1, scope.getReport().orElseThrow().getTotalStatementCount());
        assertEquals("load feed", scope.getReport().get().getLabel());
    }

    @Test
    void monitorReturnsTheBlockResult() throws Exception {
        int rows = engine.monitor("count posts", () -> {
            statementLog.append("SELECT count(*) FROM post", 0.001);
            return 42;
        });

        assertEquals(42, rows);
    }

    @Test
    void monitorPropagatesBlockExceptions() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
            () -> engine.monitor("fails", () -> {
                throw new IllegalArgumentException("bad input");
            }));
        assertEquals("bad input", thrown.getMessage());
    }

    @Test
    void nullHandleIsIgnored() {
        assertTrue(engine.end(null).isEmpty());
    }
}
