package it.berlink.querywatch.scope;

import it.berlink.querywatch.exception.InvalidScopeException;
import it.berlink.querywatch.log.StatementLog;
import it.berlink.querywatch.model.StatementRecord;

import java.time.Clock;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Opens and closes scopes over a {@link StatementLog}.
 *
 * A scope only remembers the log length and the time at which it started, so
 * scopes can be nested or overlap freely: each one slices its own range.
 * Elapsed time comes from a monotonic nanosecond source, never from the wall clock.
 */
public class ScopeTracker {

    private final StatementLog statementLog;
    private final Clock clock;
    private final LongSupplier nanoTime;

    public ScopeTracker(StatementLog statementLog) {
        this(statementLog, Clock.systemUTC(), System::nanoTime);
    }

    /**
     * @param clock    source of the wall-clock start stamp
     * @param nanoTime monotonic source used for elapsed time
     */
    public ScopeTracker(StatementLog statementLog, Clock clock, LongSupplier nanoTime) {
        this.statementLog = statementLog;
        this.clock = clock;
        this.nanoTime = nanoTime;
    }

    public ScopeHandle begin(String label) {
        int start = statementLog.length();
        statementLog.scopeOpened();
        return new ScopeHandle(label, start, clock.instant(), nanoTime.getAsLong());
    }

    /**
     * Closes the scope and returns the statements it observed.
     *
     * @throws InvalidScopeException if the handle was already closed, is detached,
     *                               or the log was reset below the scope's start
     */
    public ScopeDelta end(ScopeHandle handle) {
        if (!handle.consume()) {
            throw InvalidScopeException.alreadyClosed(handle.getLabel());
        }
        if (handle.isDetached()) {
            throw InvalidScopeException.detached(handle.getLabel());
        }

        double elapsedSeconds = (nanoTime.getAsLong() - handle.getStartNanos()) / 1_000_000_000.0;
        int start = handle.getStartSequenceIndex();
        List<StatementRecord> records;
        try {
            int end = statementLog.length();
            if (end < start) {
                throw InvalidScopeException.logShrunk(handle.getLabel(), start, end);
            }
            records = statementLog.slice(start, end);
        } finally {
            statementLog.scopeClosed();
        }

        return new ScopeDelta(handle.getLabel(), records, elapsedSeconds);
    }
}
