package it.berlink.querywatch.log;

import it.berlink.querywatch.model.StatementRecord;

import java.util.List;

/**
 * Read-only view over the statements executed in one execution context.
 *
 * The log only grows between resets; scopes address it by offset.
 */
public interface StatementLog {

    /**
     * @return number of statements currently held
     */
    int length();

    /**
     * Returns the statements at offsets {@code [from, to)}.
     *
     * @throws IndexOutOfBoundsException if the range is outside {@code [0, length()]}
     */
    List<StatementRecord> slice(int from, int to);

    /**
     * Called by the scope tracker when a scope opens over this log.
     */
    default void scopeOpened() {
    }

    /**
     * Called by the scope tracker once for every closed scope that {@link #scopeOpened()} was called for.
     */
    default void scopeClosed() {
    }
}
