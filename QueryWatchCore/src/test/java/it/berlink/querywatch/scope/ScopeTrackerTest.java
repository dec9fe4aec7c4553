package it.berlink.querywatch.scope;

import it.berlink.querywatch.exception.InvalidScopeException;
import it.berlink.querywatch.log.InMemoryStatementLog;
import it.berlink.querywatch.model.StatementRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTrackerTest {

    private InMemoryStatementLog statementLog;
    private MutableClock clock;
    private ScopeTracker tracker;

    @BeforeEach
    void setUp() {
        statementLog = new InMemoryStatementLog();
        clock = new MutableClock(Instant.parse("2026-01-25T10:00:00Z"));
        tracker = new ScopeTracker(statementLog, clock, clock::nanoTime);
    }

    @Test
    void capturesOnlyStatementsExecutedInsideTheScope() {
        statementLog.append("SELECT before", 0.001);

        ScopeHandle handle = tracker.begin("GET /posts");
        statementLog.append("SELECT inside 1", 0.002);
        statementLog.append("SELECT inside 2", 0.003);
        clock.advance(Duration.ofMillis(250));

        ScopeDelta delta = tracker.end(handle);

        assertEquals("GET /posts", delta.label());
        assertEquals(List.of("SELECT inside 1", "SELECT inside 2"),
            delta.records().stream().map(StatementRecord::text).toList());
        assertEquals(0.25, delta.elapsedSeconds(), 1e-9);
        assertEquals(1, handle.getStartSequenceIndex());
        assertEquals(Instant.parse("2026-01-25T10:00:00Z"), handle.getStartTime());
    }

    @Test
    void elapsedTimeIgnoresWallClockSteps() {
        ScopeHandle backwards = tracker.begin("clock stepped back");
        clock.advance(Duration.ofMillis(300));
        clock.stepWallClock(Duration.ofHours(-1));
        assertEquals(0.3, tracker.end(backwards).elapsedSeconds(), 1e-9);

        ScopeHandle forwards = tracker.begin("clock stepped forward");
        clock.advance(Duration.ofMillis(50));
        clock.stepWallClock(Duration.ofMinutes(10));
        assertEquals(0.05, tracker.end(forwards).elapsedSeconds(), 1e-9);
    }

    @Test
    void nestedScopesSliceIndependently() {
        ScopeHandle outer = tracker.begin("request");
        statementLog.append("SELECT a", 0.001);

        ScopeHandle inner = tracker.begin("load comments");
        statementLog.append("SELECT b", 0.001);
        statementLog.append("SELECT c", 0.001);
        ScopeDelta innerDelta = tracker.end(inner);

        statementLog.append("SELECT d", 0.001);
        ScopeDelta outerDelta = tracker.end(outer);

        assertEquals(2, innerDelta.records().size());
        assertEquals(4, outerDelta.records().size());
    }

    @Test
    void scopeWithoutStatementsHasEmptyDelta() {
        ScopeHandle handle = tracker.begin("idle");
        assertTrue(tracker.end(handle).records().isEmpty());
    }

    @Test
    void secondEndFailsWithoutRecountingStatements() {
        ScopeHandle handle = tracker.begin("twice");
        statementLog.append("SELECT 1", 0.001);

        ScopeDelta first = tracker.end(handle);
        statementLog.append("SELECT 2", 0.001);

        InvalidScopeException e = assertThrows(InvalidScopeException.class, () -> tracker.end(handle));
        assertEquals(InvalidScopeException.Reason.ALREADY_CLOSED, e.getReason());
        assertEquals("twice", e.getLabel());
        assertEquals(1, first.records().size());
        assertTrue(handle.isConsumed());
    }

    @Test
    void failsWhenLogWasResetBelowTheStart() {
        statementLog.append("SELECT 1", 0.001);
        statementLog.append("SELECT 2", 0.001);
        ScopeHandle handle = tracker.begin("reset");

        statementLog.clear();

        InvalidScopeException e = assertThrows(InvalidScopeException.class, () -> tracker.end(handle));
        assertEquals(InvalidScopeException.Reason.LOG_SHRUNK, e.getReason());
    }

    @Test
    void detachedHandleCannotBeClosed() {
        ScopeHandle handle = ScopeHandle.detached("broken", Instant.now());

        InvalidScopeException e = assertThrows(InvalidScopeException.class, () -> tracker.end(handle));
        assertEquals(InvalidScopeException.Reason.DETACHED, e.getReason());
    }
}
