package it.berlink.querywatch.log;

import it.berlink.querywatch.model.StatementRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, append-only statement buffer.
 *
 * Once {@code capacity} statements are held, further appends are dropped until
 * {@link #clear()} is called. Sequence indexes come from a process-wide counter
 * and are never reused, not even after a clear.
 */
@Slf4j
public class InMemoryStatementLog implements StatementLog {

    public static final int DEFAULT_CAPACITY = 10_000;

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final int capacity;
    private final List<StatementRecord> records = new ArrayList<>();
    private long dropped = 0;

    public InMemoryStatementLog() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryStatementLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    public boolean append(String text, double durationSeconds) {
        return append(text, durationSeconds, Instant.now(), null);
    }

    /**
     * Appends a statement.
     *
     * @return false if the buffer is full and the statement was dropped
     */
    public synchronized boolean append(String text, double durationSeconds, Instant executedAt, String origin) {
        if (records.size() >= capacity) {
            if (dropped++ == 0) {
                log.warn("Statement log full ({} statements), dropping statements until the next reset", capacity);
            }
            return false;
        }
        records.add(new StatementRecord(text, durationSeconds, SEQUENCE.getAndIncrement(), executedAt, origin));
        return true;
    }

    @Override
    public synchronized int length() {
        return records.size();
    }

    @Override
    public synchronized List<StatementRecord> slice(int from, int to) {
        if (from < 0 || to > records.size() || from > to) {
            throw new IndexOutOfBoundsException(
                "Invalid slice [" + from + ", " + to + ") of log with length " + records.size());
        }
        return List.copyOf(records.subList(from, to));
    }

    /**
     * Drops every held statement. Open scopes on this log become invalid.
     */
    public synchronized void clear() {
        if (dropped > 0) {
            log.debug("Statement log reset after dropping {} statements", dropped);
        }
        records.clear();
        dropped = 0;
    }

    public synchronized long getDroppedCount() {
        return dropped;
    }

    public int getCapacity() {
        return capacity;
    }
}
