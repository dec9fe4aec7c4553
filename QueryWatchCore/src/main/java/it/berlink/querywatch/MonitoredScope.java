package it.berlink.querywatch;

import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.scope.ScopeHandle;

import java.util.Optional;

/**
 * A scope bound to try-with-resources. Closing it twice is harmless.
 */
public class MonitoredScope implements AutoCloseable {

    private final QueryWatchEngine engine;
    private final ScopeHandle handle;
    private Optional<ScopeReport> report = Optional.empty();
    private boolean closed;

    MonitoredScope(QueryWatchEngine engine, ScopeHandle handle) {
        this.engine = engine;
        this.handle = handle;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        report = engine.end(handle);
    }

    /**
     * @return the report produced on close, empty while the scope is open
     */
    public Optional<ScopeReport> getReport() {
        return report;
    }

    public ScopeHandle getHandle() {
        return handle;
    }
}
