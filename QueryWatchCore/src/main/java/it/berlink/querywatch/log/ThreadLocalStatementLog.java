package it.berlink.querywatch.log;

import it.berlink.querywatch.model.StatementRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Statement log scoped to the calling thread.
 *
 * JDBC listeners append to it from the thread that executes the statement and
 * request scopes read it from the same thread, so concurrent requests never see
 * each other's statements. A single shared instance exists because listeners are
 * instantiated by the driver, outside any container.
 *
 * Statements are only recorded while at least one scope is open on the thread.
 * The thread's buffer is released when its outermost scope closes.
 */
public final class ThreadLocalStatementLog implements StatementLog {

    private static final ThreadLocalStatementLog INSTANCE = new ThreadLocalStatementLog();

    private volatile int capacity = InMemoryStatementLog.DEFAULT_CAPACITY;

    private final ThreadLocal<ThreadState> current = new ThreadLocal<>();

    private ThreadLocalStatementLog() {
    }

    public static ThreadLocalStatementLog getInstance() {
        return INSTANCE;
    }

    /**
     * Sets the buffer capacity for threads whose buffer is created afterwards.
     */
    public void setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return false if no scope is open on this thread or the buffer is full
     */
    public boolean append(String text, double durationSeconds, Instant executedAt, String origin) {
        ThreadState state = current.get();
        if (state == null) {
            return false;
        }
        return state.log.append(text, durationSeconds, executedAt, origin);
    }

    @Override
    public int length() {
        ThreadState state = current.get();
        return state == null ? 0 : state.log.length();
    }

    @Override
    public List<StatementRecord> slice(int from, int to) {
        ThreadState state = current.get();
        if (state == null) {
            Objects.checkFromToIndex(from, to, 0);
            return List.of();
        }
        return state.log.slice(from, to);
    }

    @Override
    public void scopeOpened() {
        ThreadState state = current.get();
        if (state == null) {
            state = new ThreadState(new InMemoryStatementLog(capacity));
            current.set(state);
        }
        state.openScopes++;
    }

    @Override
    public void scopeClosed() {
        ThreadState state = current.get();
        if (state == null) {
            return;
        }
        if (--state.openScopes <= 0) {
            current.remove();
        }
    }

    /**
     * @return number of scopes currently open on the calling thread
     */
    public int openScopes() {
        ThreadState state = current.get();
        return state == null ? 0 : state.openScopes;
    }

    /**
     * Discards the calling thread's buffer and forgets its open scopes.
     */
    public void clear() {
        current.remove();
    }

    private static final class ThreadState {

        private final InMemoryStatementLog log;
        private int openScopes;

        private ThreadState(InMemoryStatementLog log) {
            this.log = log;
        }
    }
}
