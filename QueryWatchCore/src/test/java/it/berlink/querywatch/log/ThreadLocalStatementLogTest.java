package it.berlink.querywatch.log;

import it.berlink.querywatch.QueryWatchEngine;
import it.berlink.querywatch.MonitoredScope;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.scope.ScopeHandle;
import it.berlink.querywatch.scope.ScopeTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ThreadLocalStatementLogTest {

    private final ThreadLocalStatementLog statementLog = ThreadLocalStatementLog.getInstance();

    @AfterEach
    void tearDown() {
        statementLog.clear();
        statementLog.setCapacity(InMemoryStatementLog.DEFAULT_CAPACITY);
    }

    @Test
    void threadsDoNotSeeEachOthersStatements() throws Exception {
        statementLog.scopeOpened();
        statementLog.append("SELECT main", 0.001, Instant.now(), null);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> otherLength = executor.submit(() -> {
                statementLog.scopeOpened();
                statementLog.append("SELECT worker 1", 0.001, Instant.now(), null);
                statementLog.append("SELECT worker 2", 0.001, Instant.now(), null);
                int length = statementLog.length();
                statementLog.scopeClosed();
                return length;
            });
            assertEquals(2, otherLength.get());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, statementLog.length());
        assertEquals("SELECT main", statementLog.slice(0, 1).get(0).text());
    }

    @Test
    void ignoresStatementsOutsideScopes() {
        assertFalse(statementLog.append("SELECT 1", 0.001, Instant.now(), null));

        assertEquals(0, statementLog.length());
        assertTrue(statementLog.slice(0, 0).isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> statementLog.slice(0, 1));
    }

    @Test
    void scopeOnBackgroundThreadSeesItsStatementsAfterUnscopedWork() {
        statementLog.setCapacity(30);
        for (int i = 0; i < 40; i++) {
            statementLog.append("SELECT * FROM job_run WHERE id = " + i, 0.001, Instant.now(), null);
        }

        QueryWatchEngine engine = new QueryWatchEngine(statementLog, ThresholdConfig.defaults());
        MonitoredScope scope = engine.open("nightly job");
        for (int i = 0; i < 25; i++) {
            statementLog.append("SELECT * FROM comment WHERE post_id = " + i, 0.002, Instant.now(), null);
        }
        scope.close();

        ScopeReport report = scope.getReport().orElseThrow();
        assertEquals(25, report.getTotalStatementCount());
        assertTrue(report.isSuspectedNPlusOne());
    }

    @Test
    void bufferIsReleasedWhenOutermostScopeCloses() {
        ScopeTracker tracker = new ScopeTracker(statementLog);
        ScopeHandle outer = tracker.begin("request");
        statementLog.append("SELECT a", 0.001, Instant.now(), null);
        ScopeHandle inner = tracker.begin("load comments");
        statementLog.append("SELECT b", 0.001, Instant.now(), null);

        assertEquals(1, tracker.end(inner).records().size());
        assertEquals(1, statementLog.openScopes());
        assertEquals(2, statementLog.length());

        assertEquals(2, tracker.end(outer).records().size());
        assertEquals(0, statementLog.openScopes());
        assertEquals(0, statementLog.length());
        assertFalse(statementLog.append("SELECT after", 0.001, Instant.now(), null));
    }

    @Test
    void clearResetsOnlyTheCallingThread() {
        statementLog.scopeOpened();
        statementLog.append("SELECT 1", 0.001, Instant.now(), null);
        statementLog.clear();
        assertEquals(0, statementLog.length());
        assertEquals(0, statementLog.openScopes());
    }

    @Test
    void rejectsInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> statementLog.setCapacity(0));
    }
}
